package eu.virtualparadox.ctxstore.catalog.entity;

import eu.virtualparadox.ctxstore.catalog.EDocumentType;
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
@Table(name = "documents", indexes = @Index(name = "idx_documents_repo", columnList = "repo_id"))
@Getter
@Setter
@NoArgsConstructor
public class DocumentEntity extends ContextEntity {

    @Column(length = 512, nullable = false)
    private String title;

    @Lob
    @Column(nullable = false)
    private String content;

    @Column(length = 4096)
    @Convert(converter = StringListConverter.class)
    private List<String> tags = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", length = 32, nullable = false)
    private EDocumentType documentType = EDocumentType.GENERAL;

    @Column(name = "mime_type", length = 128, nullable = false)
    private String mimeType = "text/plain";

    @Override
    public EEntityType getEntityType() {
        return EEntityType.DOCUMENT;
    }

    @Override
    public String getDisplayName() {
        return title;
    }

    /**
     * Documents are categorised by their document type.
     */
    @Override
    public String getCategory() {
        return documentType == null ? null : documentType.value();
    }

    @Override
    public void applyFields(final ContextFields f) {
        if (f.getTitle() != null) title = f.getTitle();
        if (f.getContent() != null) content = f.getContent();
        if (f.getTags() != null) tags = copyOf(f.getTags());
        if (f.getDocumentType() != null) documentType = EDocumentType.fromValue(f.getDocumentType());
        if (f.getMimeType() != null) mimeType = f.getMimeType();
    }

    @Override
    public List<String> missingRequiredFields() {
        final List<String> missing = new ArrayList<>();
        requireText(missing, title, "title");
        requireText(missing, content, "content");
        return missing;
    }
}
