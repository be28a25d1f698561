package eu.virtualparadox.ctxstore.catalog.entity;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.converter.StringListConverter;
import eu.virtualparadox.ctxstore.catalog.model.ContextFields;
import eu.virtualparadox.ctxstore.common.EPriority;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "business_rules", indexes = @Index(name = "idx_business_rules_repo_name", columnList = "repo_id,name"))
@Getter
@Setter
@NoArgsConstructor
public class BusinessRuleEntity extends ContextEntity {

    @Column(length = 512, nullable = false)
    private String name;

    @Column(length = 8192, nullable = false)
    private String description;

    @Column(name = "validation_logic", length = 4096)
    private String validationLogic;

    @Column(length = 4096)
    @Convert(converter = StringListConverter.class)
    private List<String> examples = new ArrayList<>();

    @Column(name = "related_domains", length = 4096)
    @Convert(converter = StringListConverter.class)
    private List<String> relatedDomains = new ArrayList<>();

    @Column(length = 256)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private EPriority priority = EPriority.MEDIUM;

    @Column(nullable = false)
    private boolean active = true;

    @Override
    public EEntityType getEntityType() {
        return EEntityType.BUSINESS_RULE;
    }

    @Override
    public String getDisplayName() {
        return name;
    }

    @Override
    public void applyFields(final ContextFields f) {
        if (f.getName() != null) name = f.getName();
        if (f.getDescription() != null) description = f.getDescription();
        if (f.getValidationLogic() != null) validationLogic = f.getValidationLogic();
        if (f.getExamples() != null) examples = copyOf(f.getExamples());
        if (f.getRelatedDomains() != null) relatedDomains = copyOf(f.getRelatedDomains());
        if (f.getCategory() != null) category = f.getCategory();
        if (f.getPriority() != null) priority = EPriority.fromValue(f.getPriority());
        if (f.getActive() != null) active = f.getActive();
    }

    @Override
    public List<String> missingRequiredFields() {
        final List<String> missing = new ArrayList<>();
        requireText(missing, name, "name");
        requireText(missing, description, "description");
        return missing;
    }
}
