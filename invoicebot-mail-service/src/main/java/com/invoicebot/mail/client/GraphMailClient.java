package com.invoicebot.mail.client;

import com.invoicebot.common.client.GraphApiClient;
import com.invoicebot.mail.dto.GraphAttachment;
import com.invoicebot.mail.dto.GraphMessage;
import com.invoicebot.mail.dto.GraphPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Access to the signed-in user's mailbox through Microsoft Graph: reads, plus
 * saving the monthly report as a draft. Nothing is ever sent. Every call goes
 * through {@link GraphApiClient} and so gets the single refresh-and-retry on
 * 401.
 */
@Slf4j
@Component
public class GraphMailClient {

    private static final String MESSAGE_FIELDS = "id,sender,subject,receivedDateTime,hasAttachments,body";
    private static final String ATTACHMENT_FIELDS = "id,name,contentType,size,isInline";

    private static final ParameterizedTypeReference<GraphPage<GraphMessage>> MESSAGE_PAGE =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<GraphPage<GraphAttachment>> ATTACHMENT_PAGE =
            new ParameterizedTypeReference<>() {
            };

    private final GraphApiClient graph;

    public GraphMailClient(GraphApiClient graph) {
        this.graph = graph;
    }

    /**
     * Messages of {@code folder} received after {@code since}, newest first.
     * Follows {@code @odata.nextLink} until the collection is exhausted.
     *
     * @param pageSize server page size, already capped at 1000
     */
    public List<GraphMessage> listMessages(String folder, Instant since, int pageSize) {
        String filter = "receivedDateTime gt "
                + DateTimeFormatter.ISO_INSTANT.format(since.truncatedTo(ChronoUnit.SECONDS));

        List<GraphMessage> messages = new ArrayList<>();
        GraphPage<GraphMessage> page = graph.execute("list " + folder, (client, auth) -> client
                .get()
                .uri(uriBuilder -> uriBuilder
                        .path("/me/mailFolders/{folder}/messages")
                        .queryParam("$select", MESSAGE_FIELDS)
                        .queryParam("$filter", filter)
                        .queryParam("$orderby", "receivedDateTime desc")
                        .queryParam("$top", pageSize)
                        .build(folder))
                .header(HttpHeaders.AUTHORIZATION, auth)
                .retrieve()
                .bodyToMono(MESSAGE_PAGE));

        int pages = 0;
        while (page != null) {
            pages++;
            messages.addAll(page.getValue());
            String next = page.getNextLink();
            if (next == null || next.isBlank()) {
                break;
            }
            URI nextUri = URI.create(next);
            page = graph.execute("list " + folder + " (page " + (pages + 1) + ")", (client, auth) -> client
                    .get()
                    .uri(nextUri)
                    .header(HttpHeaders.AUTHORIZATION, auth)
                    .retrieve()
                    .bodyToMono(MESSAGE_PAGE));
        }

        log.info("Fetched {} message(s) from '{}' since {} in {} page(s)", messages.size(), folder, since, pages);
        return messages;
    }

    /**
     * Attachment metadata only. The listing is not trusted to carry content.
     */
    public List<GraphAttachment> listAttachments(String messageId) {
        GraphPage<GraphAttachment> page = graph.execute("list attachments", (client, auth) -> client
                .get()
                .uri(uriBuilder -> uriBuilder
                        .path("/me/messages/{id}/attachments")
                        .queryParam("$select", ATTACHMENT_FIELDS)
                        .build(messageId))
                .header(HttpHeaders.AUTHORIZATION, auth)
                .retrieve()
                .bodyToMono(ATTACHMENT_PAGE));
        return page == null ? List.of() : page.getValue();
    }

    /**
     * Single attachment including its base64 {@code contentBytes}.
     */
    public GraphAttachment getAttachment(String messageId, String attachmentId) {
        return graph.execute("get attachment", (client, auth) -> client
                .get()
                .uri("/me/messages/{id}/attachments/{attachmentId}", messageId, attachmentId)
                .header(HttpHeaders.AUTHORIZATION, auth)
                .retrieve()
                .bodyToMono(GraphAttachment.class));
    }

    /**
     * Save {@code message} (Graph message JSON, attachments inline) to the
     * Drafts folder.
     *
     * @return id of the draft
     */
    public String createDraft(Map<String, Object> message) {
        GraphMessage draft = graph.execute("create draft", (client, auth) -> client
                .post()
                .uri("/me/messages")
                .header(HttpHeaders.AUTHORIZATION, auth)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(message)
                .retrieve()
                .bodyToMono(GraphMessage.class));
        if (draft == null || draft.getId() == null) {
            throw new IllegalStateException("Draft creation returned no message id");
        }
        return draft.getId();
    }
}
