package eu.virtualparadox.ctxstore.ingest.hash;

import eu.virtualparadox.ctxstore.catalog.entity.BusinessRuleEntity;
import eu.virtualparadox.ctxstore.catalog.entity.ConventionEntity;
import eu.virtualparadox.ctxstore.catalog.entity.DocumentEntity;
import eu.virtualparadox.ctxstore.catalog.entity.GlossaryEntryEntity;
import eu.virtualparadox.ctxstore.catalog.entity.PatternEntity;
import eu.virtualparadox.ctxstore.ingest.model.Embeddable;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Builds the canonical text of an embeddable and its SHA-256 content hash.
 * <p>The canonical text is what gets embedded, so a change in any field that feeds it
 * changes the hash and triggers re-embedding. Fields are always emitted in the same order:
 * the name first, then the body, then the auxiliary lists.</p>
 */
@Component
public class ContentHasher {

    /**
     * @param entity context entity or ticket
     * @return deterministic text representation of {@code entity}
     */
    public String canonicalText(final Embeddable entity) {
        return switch (entity.getEntityType()) {
            case BUSINESS_RULE -> businessRule((BusinessRuleEntity) entity);
            case GLOSSARY_ENTRY -> glossaryEntry((GlossaryEntryEntity) entity);
            case PATTERN -> pattern((PatternEntity) entity);
            case CONVENTION -> convention((ConventionEntity) entity);
            case DOCUMENT -> document((DocumentEntity) entity);
            case TICKET -> ticket((TicketEntity) entity);
        };
    }

    /**
     * @param text canonical text
     * @return lowercase hex SHA-256 digest of the UTF-8 bytes of {@code text}
     */
    public String hash(final String text) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String businessRule(final BusinessRuleEntity r) {
        final StringBuilder sb = new StringBuilder();
        sb.append(r.getName()).append(": ").append(r.getDescription());
        appendIfPresent(sb, ". Validation: ", r.getValidationLogic());
        appendJoined(sb, ". Examples: ", r.getExamples(), ", ");
        appendJoined(sb, ". Related domains: ", r.getRelatedDomains(), ", ");
        return sb.toString();
    }

    private String glossaryEntry(final GlossaryEntryEntity g) {
        final StringBuilder sb = new StringBuilder();
        sb.append(g.getTerm()).append(": ").append(g.getDefinition());
        appendJoined(sb, ". Synonyms: ", g.getSynonyms(), ", ");
        appendJoined(sb, ". Related: ", g.getRelatedTerms(), ", ");
        appendJoined(sb, ". Examples: ", g.getExamples(), ", ");
        return sb.toString();
    }

    private String pattern(final PatternEntity p) {
        final StringBuilder sb = new StringBuilder();
        sb.append(p.getName()).append(": ").append(p.getDescription());
        appendIfPresent(sb, ". When to use: ", p.getWhenToUse());
        appendJoined(sb, ". Benefits: ", p.getBenefits(), ", ");
        appendIfPresent(sb, ". Example: ", p.getExample());
        return sb.toString();
    }

    private String convention(final ConventionEntity c) {
        return c.getCategory() + ": " + c.getRule();
    }

    private String document(final DocumentEntity d) {
        return d.getTitle() + "\n\n" + d.getContent();
    }

    private String ticket(final TicketEntity t) {
        final StringBuilder sb = new StringBuilder();
        sb.append("Task: ").append(t.getTitle());
        appendIfPresent(sb, ". Description: ", t.getDescription());
        if (t.getType() != null) {
            sb.append(". Type: ").append(t.getType().value());
        }
        if (t.getPriority() != null) {
            sb.append(". Priority: ").append(t.getPriority().value());
        }
        appendJoined(sb, ". Objectives: ", t.getObjectives(), "; ");
        appendJoined(sb, ". Validation: ", t.getValidationCriteria(), "; ");
        appendJoined(sb, ". Tags: ", t.getTags(), ", ");
        return sb.toString();
    }

    private static void appendIfPresent(final StringBuilder sb, final String label, final String value) {
        if (value != null && !value.isBlank()) {
            sb.append(label).append(value);
        }
    }

    private static void appendJoined(final StringBuilder sb,
                                     final String label,
                                     final List<String> values,
                                     final String separator) {
        if (values != null && !values.isEmpty()) {
            sb.append(label).append(String.join(separator, values));
        }
    }
}
