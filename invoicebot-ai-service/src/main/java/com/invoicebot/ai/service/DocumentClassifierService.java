package com.invoicebot.ai.service;

import com.invoicebot.ai.service.extract.DocumentTextExtractor;
import com.invoicebot.ai.service.strategy.ClassificationModelStrategy;
import com.invoicebot.ai.service.strategy.ClassificationModelStrategy.ModelReply;
import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.model.CandidateDocument;
import com.invoicebot.common.model.ClassificationVerdict;
import com.invoicebot.common.model.Decision;
import com.invoicebot.common.model.SupportedMediaTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Document Classifier: document bytes in, {@link ClassificationVerdict} out.
 *
 * PDFs and spreadsheets are reduced to text locally and sent as a text
 * prompt; images go to the vision call as base64. Both answers go through
 * {@link ClassificationResponseParser}. Nothing here throws: unsupported
 * types, empty text, failed model calls and unparseable answers all become a
 * REVIEW verdict. Holds no mutable state.
 */
@Slf4j
@Service
public class DocumentClassifierService {

    private final ClassificationModelStrategy model;
    private final ClassificationResponseParser parser;
    private final List<DocumentTextExtractor> extractors;
    private final double threshold;

    public DocumentClassifierService(ClassificationModelStrategy model,
            ClassificationResponseParser parser,
            List<DocumentTextExtractor> extractors,
            InvoiceBotProperties properties) {
        this.model = model;
        this.parser = parser;
        this.extractors = extractors;
        this.threshold = properties.getClassifier().getConfidenceThreshold();
    }

    /**
     * @param supplierHint supplier name configured for the sender, may be null
     */
    public ClassificationVerdict classify(CandidateDocument document, String supplierHint) {
        log.info("Classifying: file='{}' type={} size={} bytes threshold={} hint='{}'",
                document.name(), document.mediaType(), document.size(), threshold, supplierHint);

        if (!model.isConfigured()) {
            log.warn("Classifier API key not configured, sending '{}' to review", document.name());
            return ClassificationVerdict.review("Classifier not configured");
        }
        if (document.isContainer()) {
            log.warn("Container '{}' reached the classifier unexpanded, sending to review", document.name());
            return ClassificationVerdict.review("Container not expanded");
        }

        try {
            ModelReply reply;
            Optional<String> imageType = SupportedMediaTypes.imageType(document.mediaType(), document.name());
            if (imageType.isPresent()) {
                reply = model.classifyImage(ClassificationPrompts.SYSTEM,
                        ClassificationPrompts.imagePrompt(supplierHint), document.content(), imageType.get());
            } else {
                Optional<DocumentTextExtractor> extractor = extractors.stream()
                        .filter(e -> e.supports(document.mediaType(), document.name()))
                        .findFirst();
                if (extractor.isEmpty()) {
                    log.info("Classifying: file='{}' unsupported type {}, routing to review",
                            document.name(), document.mediaType());
                    return ClassificationVerdict.review("Unsupported media type " + document.mediaType());
                }

                String text = extractText(extractor.get(), document);
                if (text.isBlank()) {
                    log.info("No text extracted from '{}', routing to review", document.name());
                    return ClassificationVerdict.review("No text extracted");
                }
                reply = model.classifyText(ClassificationPrompts.SYSTEM,
                        ClassificationPrompts.textPrompt(text, supplierHint));
            }

            if (!reply.isSuccessful()) {
                log.warn("Model call failed for '{}': {}", document.name(), reply.getErrorMessage());
                return ClassificationVerdict.review("Model call failed: " + reply.getErrorMessage());
            }

            Optional<ModelAssessment> assessment = parser.parse(reply.getText());
            if (assessment.isEmpty()) {
                return ClassificationVerdict.review("Unparseable model response");
            }

            ClassificationVerdict verdict = toVerdict(assessment.get());
            log.info("Classification result: file='{}' decision={} confidence={} date={} supplier='{}' " +
                    "ht={} tva={} ttc={} currency={} reason='{}'",
                    document.name(), verdict.decision(), verdict.confidence(), verdict.invoiceDate(),
                    verdict.supplierName(), verdict.amountPretax(), verdict.amountTax(),
                    verdict.amountTotal(), verdict.currency(), verdict.reason());
            return verdict;

        } catch (Exception e) {
            log.warn("Classifier failed for '{}': {}, routing to review", document.name(), e.getMessage(), e);
            return ClassificationVerdict.review("Classifier error: " + e.getMessage());
        }
    }

    /**
     * The single policy point: INVOICE or REJECTED only at or above the
     * threshold, REVIEW below it either way.
     */
    public Decision decide(boolean isInvoice, double confidence) {
        if (confidence >= threshold) {
            return isInvoice ? Decision.INVOICE : Decision.REJECTED;
        }
        return Decision.REVIEW;
    }

    private ClassificationVerdict toVerdict(ModelAssessment a) {
        return new ClassificationVerdict(
                decide(a.invoice(), a.confidence()),
                a.confidence(),
                a.invoiceDate(),
                a.supplier(),
                a.amountPretax(),
                a.amountTax(),
                a.amountTotal(),
                a.currency(),
                a.reason());
    }

    private String extractText(DocumentTextExtractor extractor, CandidateDocument document) {
        try {
            return extractor.extract(document.content());
        } catch (Exception e) {
            log.warn("Text extraction failed for '{}': {}", document.name(), e.getMessage());
            return "";
        }
    }
}
