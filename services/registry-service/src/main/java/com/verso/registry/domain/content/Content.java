package com.verso.registry.domain.content;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.verso.registry.common.IdGenerator;
import com.verso.registry.domain.VersionedEntity;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A piece of content of a given type: a book, a chapter, an article or a category.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Content extends VersionedEntity {
    private ContentType type;
    private String editorId;
    private String editorName;
    private String comment;
    private String title;
    private String subtitle;
    private String body;
    private int wordCount;
    private List<String> tags = new ArrayList<>();
    private List<Author> authors = new ArrayList<>();

    /**
     * Display title, e.g. {@code "Dune: Book One (BOOK)"}.
     */
    public String titleText() {
        String typeName = type == null ? "CONTENT" : type.name();
        boolean hasTitle = title != null && !title.isBlank();
        boolean hasSubtitle = subtitle != null && !subtitle.isBlank();
        if (hasTitle && hasSubtitle) {
            return title + ": " + subtitle + " (" + typeName + ")";
        }
        if (hasTitle) {
            return title + " (" + typeName + ")";
        }
        return typeName + " " + getId();
    }

    public List<String> authorNames() {
        List<String> names = new ArrayList<>();
        for (Author author : authors) {
            if (author.getName() != null && !author.getName().isBlank()) {
                names.add(author.getName());
            }
        }
        return names;
    }

    public String typeName() {
        return type == null ? null : type.name();
    }

    public int countWords() {
        if (body == null || body.isBlank()) {
            return 0;
        }
        return body.trim().split("\\s+").length;
    }

    @Override
    public List<String> validate() {
        List<String> problems = super.validate();
        if (type == null) {
            problems.add("Type is missing");
        }
        if (title == null || title.isBlank()) {
            problems.add("Title is missing");
        }
        if (editorId != null && !IdGenerator.isEntityId(editorId)) {
            problems.add("EditorID is invalid");
        }
        for (Author author : authors) {
            if (author.getName() == null || author.getName().isBlank()) {
                problems.add("Author name is missing");
            }
        }
        return problems;
    }

    public void normalizeTags() {
        List<String> normalized = new ArrayList<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                String value = tag.trim().toLowerCase(Locale.ROOT);
                if (!normalized.contains(value)) {
                    normalized.add(value);
                }
            }
        }
        tags = normalized;
    }

    public ContentType getType() {
        return type;
    }

    public void setType(ContentType type) {
        this.type = type;
    }

    public String getEditorId() {
        return editorId;
    }

    public void setEditorId(String editorId) {
        this.editorId = editorId;
    }

    public String getEditorName() {
        return editorName;
    }

    public void setEditorName(String editorName) {
        this.editorName = editorName;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSubtitle() {
        return subtitle;
    }

    public void setSubtitle(String subtitle) {
        this.subtitle = subtitle;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public int getWordCount() {
        return wordCount;
    }

    public void setWordCount(int wordCount) {
        this.wordCount = wordCount;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags == null ? new ArrayList<>() : tags;
    }

    public List<Author> getAuthors() {
        return authors;
    }

    public void setAuthors(List<Author> authors) {
        this.authors = authors == null ? new ArrayList<>() : authors;
    }
}
