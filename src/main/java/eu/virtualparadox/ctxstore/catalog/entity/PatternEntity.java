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
@Table(name = "patterns", indexes = @Index(name = "idx_patterns_repo", columnList = "repo_id"))
@Getter
@Setter
@NoArgsConstructor
public class PatternEntity extends ContextEntity {

    @Column(length = 512, nullable = false)
    private String name;

    @Column(length = 8192, nullable = false)
    private String description;

    @Column(name = "when_to_use", length = 4096)
    private String whenToUse;

    @Lob
    @Column(name = "example")
    private String example;

    @Column(length = 4096)
    @Convert(converter = StringListConverter.class)
    private List<String> benefits = new ArrayList<>();

    @Column(length = 4096)
    @Convert(converter = StringListConverter.class)
    private List<String> tradeoffs = new ArrayList<>();

    @Column(length = 256)
    private String category;

    @Override
    public EEntityType getEntityType() {
        return EEntityType.PATTERN;
    }

    @Override
    public String getDisplayName() {
        return name;
    }

    @Override
    public void applyFields(final ContextFields f) {
        if (f.getName() != null) name = f.getName();
        if (f.getDescription() != null) description = f.getDescription();
        if (f.getWhenToUse() != null) whenToUse = f.getWhenToUse();
        if (f.getExample() != null) example = f.getExample();
        if (f.getBenefits() != null) benefits = copyOf(f.getBenefits());
        if (f.getTradeoffs() != null) tradeoffs = copyOf(f.getTradeoffs());
        if (f.getCategory() != null) category = f.getCategory();
    }

    @Override
    public List<String> missingRequiredFields() {
        final List<String> missing = new ArrayList<>();
        requireText(missing, name, "name");
        requireText(missing, description, "description");
        return missing;
    }
}
