package eu.virtualparadox.ctxstore.catalog.entity;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.converter.StringListConverter;
import eu.virtualparadox.ctxstore.catalog.model.ContextFields;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "glossary_entries", indexes = @Index(name = "idx_glossary_repo_term", columnList = "repo_id,term"))
@Getter
@Setter
@NoArgsConstructor
public class GlossaryEntryEntity extends ContextEntity {

    @Column(length = 512, nullable = false)
    private String term;

    @Column(length = 8192, nullable = false)
    private String definition;

    @Column(length = 4096)
    @Convert(converter = StringListConverter.class)
    private List<String> synonyms = new ArrayList<>();

    @Column(name = "related_terms", length = 4096)
    @Convert(converter = StringListConverter.class)
    private List<String> relatedTerms = new ArrayList<>();

    @Column(length = 4096)
    @Convert(converter = StringListConverter.class)
    private List<String> examples = new ArrayList<>();

    @Column(length = 256)
    private String category;

    @Override
    public EEntityType getEntityType() {
        return EEntityType.GLOSSARY_ENTRY;
    }

    @Override
    public String getDisplayName() {
        return term;
    }

    @Override
    public void applyFields(final ContextFields f) {
        if (f.getTerm() != null) term = f.getTerm();
        if (f.getDefinition() != null) definition = f.getDefinition();
        if (f.getSynonyms() != null) synonyms = copyOf(f.getSynonyms());
        if (f.getRelatedTerms() != null) relatedTerms = copyOf(f.getRelatedTerms());
        if (f.getExamples() != null) examples = copyOf(f.getExamples());
        if (f.getCategory() != null) category = f.getCategory();
    }

    @Override
    public List<String> missingRequiredFields() {
        final List<String> missing = new ArrayList<>();
        requireText(missing, term, "term");
        requireText(missing, definition, "definition");
        return missing;
    }
}
