package eu.virtualparadox.ctxstore.catalog.entity;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.model.ContextFields;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "conventions", indexes = @Index(name = "idx_conventions_repo", columnList = "repo_id"))
@Getter
@Setter
@NoArgsConstructor
public class ConventionEntity extends ContextEntity {

    @Column(length = 256, nullable = false)
    private String category;

    @Column(length = 8192, nullable = false)
    private String rule;

    @Column(nullable = false)
    private boolean enforced = false;

    @Override
    public EEntityType getEntityType() {
        return EEntityType.CONVENTION;
    }

    @Override
    public String getDisplayName() {
        return category;
    }

    @Override
    public void applyFields(final ContextFields f) {
        if (f.getCategory() != null) category = f.getCategory();
        if (f.getRule() != null) rule = f.getRule();
        if (f.getEnforced() != null) enforced = f.getEnforced();
    }

    @Override
    public List<String> missingRequiredFields() {
        final List<String> missing = new ArrayList<>();
        requireText(missing, category, "category");
        requireText(missing, rule, "rule");
        return missing;
    }
}
