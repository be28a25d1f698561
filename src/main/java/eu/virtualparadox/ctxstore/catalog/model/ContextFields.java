package eu.virtualparadox.ctxstore.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Field values for storing or patching a context entity. A {@code null} field means
 * "not supplied": on store the entity default applies, on update the stored value is kept.
 * Fields that do not belong to the target type are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextFields {

    // shared
    private String name;
    private String description;
    private String category;
    private List<String> examples;

    // business_rule
    private String validationLogic;
    private List<String> relatedDomains;
    private String priority;
    private Boolean active;

    // glossary_entry
    private String term;
    private String definition;
    private List<String> synonyms;
    private List<String> relatedTerms;

    // pattern
    private String whenToUse;
    private String example;
    private List<String> benefits;
    private List<String> tradeoffs;

    // convention
    private String rule;
    private Boolean enforced;

    // document
    private String title;
    private String content;
    private List<String> tags;
    private String documentType;
    private String mimeType;
}
