package com.invoicebot.common.service;

import com.invoicebot.common.client.GraphApiClient;
import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.dto.DriveItem;
import com.invoicebot.common.dto.SharingPermission;
import com.invoicebot.common.dto.StoredItem;
import com.invoicebot.common.dto.UploadSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * OneDrive object store reached through Microsoft Graph.
 *
 * Layout: {@code root/YYYY/MM/<supplier-label>/<file>} for invoices and
 * {@code root/YYYY/MM/_review/<file>} for everything else. Uploads are
 * idempotent: when a file already exists at the target path its existing
 * reference is returned and nothing is sent.
 */
@Slf4j
@Service
public class OneDriveStorageService {

    private static final String ROOT_ID = "root";
    private static final Duration CHUNK_TIMEOUT = Duration.ofSeconds(120);

    private final GraphApiClient graph;
    private final InvoiceBotProperties.Storage settings;
    private final WebClient uploadSessionClient;

    // folder path -> drive item id, for the lifetime of this instance
    private final Map<String, String> folderIds = new ConcurrentHashMap<>();

    public OneDriveStorageService(GraphApiClient graph, InvoiceBotProperties properties,
            WebClient.Builder webClientBuilder) {
        this.graph = graph;
        this.settings = properties.getStorage();
        this.uploadSessionClient = webClientBuilder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(1024 * 1024))
                .build();
    }

    /**
     * Upload a confirmed invoice to {@code root/YYYY/MM/label/filename}.
     */
    public StoredItem uploadInvoice(int year, int month, String supplierLabel, String filename, byte[] content) {
        return upload(monthPath(year, month, supplierLabel), filename, content);
    }

    /**
     * Upload anything that was not confidently classified as an invoice.
     */
    public StoredItem uploadToReview(int year, int month, String filename, byte[] content) {
        return upload(monthPath(year, month, settings.getReviewFolder()), filename, content);
    }

    /**
     * Upload directly into the month folder (monthly summary workbook).
     */
    public StoredItem uploadToMonthFolder(int year, int month, String filename, byte[] content) {
        return upload(monthPath(year, month), filename, content);
    }

    /**
     * View-only sharing link to the month folder, for the accountant. Calling
     * it again returns the link created the first time.
     */
    public String shareMonthFolder(int year, int month) {
        String folderId = resolvePath(monthPath(year, month));
        Map<String, Object> body = Map.of(
                "type", "view",
                "scope", settings.getShareScope());

        SharingPermission permission = graph.execute("share month folder", (client, auth) -> client
                .post()
                .uri("/me/drive/items/{id}/createLink", folderId)
                .header(HttpHeaders.AUTHORIZATION, auth)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(SharingPermission.class));

        if (permission == null || permission.getLink() == null || permission.getLink().getWebUrl() == null) {
            throw new IllegalStateException("createLink for " + year + "/" + month + " returned no link");
        }
        log.info("Sharing link ready for {}-{}", year, String.format("%02d", month));
        return permission.getLink().getWebUrl();
    }

    public StoredItem upload(List<String> folderPath, String filename, byte[] content) {
        String folderId = resolvePath(folderPath);

        Optional<StoredItem> existing = findExisting(folderId, filename);
        if (existing.isPresent()) {
            log.info("Already in store, skipping upload: {}/{}", String.join("/", folderPath), filename);
            return existing.get();
        }

        DriveItem item = content.length <= settings.getSimpleUploadLimit()
                ? simpleUpload(folderId, filename, content)
                : sessionUpload(folderId, filename, content);

        if (item == null || item.getId() == null) {
            throw new IllegalStateException("Upload of " + filename + " succeeded without returning an item id");
        }
        log.info("Uploaded {} ({} bytes) to {}", filename, content.length, String.join("/", folderPath));
        return new StoredItem(item.getId(), item.getWebUrl());
    }

    /**
     * Resolve every segment of {@code path} below the drive root, creating
     * missing folders on the way.
     */
    public String resolvePath(List<String> path) {
        String parentId = ROOT_ID;
        StringBuilder key = new StringBuilder();
        for (String segment : path) {
            key.append('/').append(segment);
            String cacheKey = key.toString();
            String cached = folderIds.get(cacheKey);
            if (cached != null) {
                parentId = cached;
                continue;
            }
            parentId = resolveOrCreateFolder(parentId, segment);
            folderIds.put(cacheKey, parentId);
        }
        return parentId;
    }

    /**
     * Returns the id of folder {@code name} under {@code parentId}, creating it
     * if needed. A 409 on create means another writer won the race; the folder
     * is fetched again.
     */
    public String resolveOrCreateFolder(String parentId, String name) {
        Optional<DriveItem> found = getChild(parentId, name);
        if (found.isPresent()) {
            return found.get().getId();
        }

        Map<String, Object> body = Map.of(
                "name", name,
                "folder", Map.of(),
                "@microsoft.graph.conflictBehavior", "fail");
        try {
            DriveItem created = graph.execute("create folder " + name, (client, auth) -> client
                    .post()
                    .uri("/me/drive/items/{parent}/children", parentId)
                    .header(HttpHeaders.AUTHORIZATION, auth)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(DriveItem.class));
            log.info("Created folder '{}'", name);
            return requireId(created, name);
        } catch (WebClientResponseException.Conflict e) {
            log.debug("Folder '{}' created concurrently, fetching it", name);
            return getChild(parentId, name)
                    .map(DriveItem::getId)
                    .orElseThrow(() -> new IllegalStateException("Folder " + name + " reported as existing but not found"));
        }
    }

    /**
     * Existence check by path. Empty when the store answers 404.
     */
    public Optional<StoredItem> findExisting(String folderId, String filename) {
        return getChild(folderId, filename)
                .map(item -> new StoredItem(item.getId(), item.getWebUrl()));
    }

    private Optional<DriveItem> getChild(String parentId, String name) {
        try {
            DriveItem item = graph.execute("lookup " + name, (client, auth) -> client
                    .get()
                    .uri("/me/drive/items/{parent}:/{name}", parentId, name)
                    .header(HttpHeaders.AUTHORIZATION, auth)
                    .retrieve()
                    .bodyToMono(DriveItem.class));
            return Optional.ofNullable(item);
        } catch (WebClientResponseException.NotFound e) {
            return Optional.empty();
        }
    }

    private DriveItem simpleUpload(String folderId, String filename, byte[] content) {
        return graph.execute("upload " + filename, (client, auth) -> client
                .put()
                .uri("/me/drive/items/{parent}:/{name}:/content", folderId, filename)
                .header(HttpHeaders.AUTHORIZATION, auth)
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(content)
                .retrieve()
                .bodyToMono(DriveItem.class));
    }

    /**
     * Chunked upload for payloads above the simple-upload limit. The session
     * URL is pre-authorized, so chunks go out without the bearer header.
     */
    private DriveItem sessionUpload(String folderId, String filename, byte[] content) {
        Map<String, Object> body = Map.of(
                "item", Map.of("@microsoft.graph.conflictBehavior", "replace"));

        UploadSession session = graph.execute("create upload session " + filename, (client, auth) -> client
                .post()
                .uri("/me/drive/items/{parent}:/{name}:/createUploadSession", folderId, filename)
                .header(HttpHeaders.AUTHORIZATION, auth)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(UploadSession.class));

        if (session == null || session.getUploadUrl() == null) {
            throw new IllegalStateException("Upload session for " + filename + " returned no upload URL");
        }

        URI uploadUrl = URI.create(session.getUploadUrl());
        int chunkSize = settings.getChunkSize();
        int total = content.length;
        DriveItem result = null;

        log.info("Uploading {} in chunks of {} bytes ({} bytes total)", filename, chunkSize, total);
        for (int start = 0; start < total; start += chunkSize) {
            int end = Math.min(start + chunkSize, total);
            byte[] chunk = Arrays.copyOfRange(content, start, end);
            String range = "bytes " + start + "-" + (end - 1) + "/" + total;

            result = uploadSessionClient
                    .put()
                    .uri(uploadUrl)
                    .header(HttpHeaders.CONTENT_RANGE, range)
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .bodyValue(chunk)
                    .retrieve()
                    .bodyToMono(DriveItem.class)
                    // intermediate chunks answer 202 with only nextExpectedRanges
                    .defaultIfEmpty(new DriveItem())
                    .block(CHUNK_TIMEOUT);
        }
        return result;
    }

    List<String> monthPath(int year, int month, String... extra) {
        List<String> path = new ArrayList<>();
        for (String part : settings.getRootFolder().split("/")) {
            if (!part.isBlank()) {
                path.add(part);
            }
        }
        path.add(String.valueOf(year));
        path.add(String.format("%02d", month));
        path.addAll(Arrays.asList(extra));
        return path;
    }

    private static String requireId(DriveItem item, String name) {
        if (item == null || item.getId() == null) {
            throw new IllegalStateException("Store returned no id for folder " + name);
        }
        return item.getId();
    }
}
