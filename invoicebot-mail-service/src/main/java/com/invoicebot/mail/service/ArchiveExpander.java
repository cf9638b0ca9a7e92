package com.invoicebot.mail.service;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.model.CandidateDocument;
import com.invoicebot.common.model.DocumentOrigin;
import com.invoicebot.common.model.SupportedMediaTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Archive Expander: one level of ZIP unpacking.
 *
 * Members keep their base filename and get the media type of their
 * extension. Directories, macOS metadata, unsupported extensions and nested
 * archives are skipped. A corrupt archive yields an empty list.
 */
@Slf4j
@Component
public class ArchiveExpander {

    private final long maxMemberBytes;

    public ArchiveExpander(InvoiceBotProperties properties) {
        this.maxMemberBytes = properties.getMail().getMaxAttachmentBytes();
    }

    public List<CandidateDocument> expand(CandidateDocument container) {
        List<CandidateDocument> members = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(container.content()))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                String path = entry.getName().replace('\\', '/');
                String basename = path.substring(path.lastIndexOf('/') + 1);

                if (entry.isDirectory() || basename.isEmpty()) {
                    continue;
                }
                if (path.contains("__MACOSX") || basename.startsWith("._")) {
                    log.debug("ZIP '{}': skipping metadata entry {}", container.name(), path);
                    continue;
                }
                Optional<String> mediaType = SupportedMediaTypes.forDocumentExtension(basename);
                if (mediaType.isEmpty()) {
                    log.debug("ZIP '{}': skipping unsupported member {}", container.name(), path);
                    continue;
                }

                byte[] bytes = readMember(zip);
                if (bytes == null) {
                    log.warn("ZIP '{}': member {} exceeds {} bytes, skipped", container.name(), path, maxMemberBytes);
                    continue;
                }
                members.add(new CandidateDocument(basename, mediaType.get(), bytes, DocumentOrigin.ARCHIVE_MEMBER));
                log.debug("ZIP '{}': extracted {} ({} bytes)", container.name(), basename, bytes.length);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("ZIP '{}' is corrupt or unreadable: {}", container.name(), e.getMessage());
            return List.of();
        }

        log.info("ZIP '{}' expanded to {} supported file(s)", container.name(), members.size());
        return members;
    }

    /** Member bytes, or null when the member is larger than the cap. */
    private byte[] readMember(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxMemberBytes) {
                return null;
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }
}
