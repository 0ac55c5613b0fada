package com.vidnyan.doclint.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    @Test
    void requireContent_UnreadableDocument_ShouldThrow() {
        Document doc = Document.unreadable("docs/missing.md");

        DocumentUnreadableException e = assertThrows(DocumentUnreadableException.class, doc::requireContent);
        assertEquals("cannot read document docs/missing.md", e.getMessage());
    }

    @Test
    void requireContent_ReadableDocument_ShouldReturnText() {
        assertEquals("# Title", new Document("README.md", "# Title").requireContent());
    }

    @Test
    void displayName_ShouldUseFileNamePortion() {
        assertEquals("missing.md", Document.unreadable("docs/missing.md").displayName());
        assertEquals("README.md", new Document("README.md", "").displayName());
    }
}
