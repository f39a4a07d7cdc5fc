package com.docassets.util;

import com.docassets.model.AssetReference.AssetType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MimeTypesTest {

    @Test
    void testGetMimeType_KnownExtensions() {
        assertEquals("image/png", MimeTypes.getMimeType("logo.PNG"));
        assertEquals("image/jpeg", MimeTypes.getMimeType("photo.jpeg"));
        assertEquals("image/svg+xml", MimeTypes.getMimeType("diagram.svg"));
        assertEquals("application/pdf", MimeTypes.getMimeType("guide.pdf"));
        assertEquals("text/csv", MimeTypes.getMimeType("data.csv"));
    }

    @Test
    void testGetMimeType_UnknownExtension_ShouldBeOctetStream() {
        assertEquals(MimeTypes.OCTET_STREAM, MimeTypes.getMimeType("tool.exe"));
        assertEquals(MimeTypes.OCTET_STREAM, MimeTypes.getMimeType("Makefile"));
    }

    @Test
    void testDetermineAssetTypeFromPath() {
        assertEquals(AssetType.IMAGE, MimeTypes.determineAssetTypeFromPath("a.webp"));
        assertEquals(AssetType.BINARY, MimeTypes.determineAssetTypeFromPath("a.xlsx"));
        assertEquals(AssetType.UNKNOWN, MimeTypes.determineAssetTypeFromPath("a.mp4"));
    }

    @Test
    void testTypeDirectory() {
        assertEquals("images", MimeTypes.typeDirectory(AssetType.IMAGE));
        assertEquals("files", MimeTypes.typeDirectory(AssetType.BINARY));
    }
}
