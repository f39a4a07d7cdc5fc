package com.docassets.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest {

    @Test
    void testGetExtensionNormalFile() {
        assertEquals("png", FileUtils.getExtension("logo.png"));
        assertEquals("pdf", FileUtils.getExtension("en/v1/assets/files/guide.pdf"));
    }

    @Test
    void testGetExtensionHiddenFile() {
        // ".gitignore" -> dot at index 0, no extension
        assertEquals("", FileUtils.getExtension(".gitignore"));
    }

    @Test
    void testGetExtensionMixedCase() {
        assertEquals("png", FileUtils.getExtension("Logo.PNG"));
    }

    @Test
    void testGetExtensionNullOrEmpty() {
        assertEquals("", FileUtils.getExtension(null));
        assertEquals("", FileUtils.getExtension(""));
    }

    @Test
    void testGetDottedExtensionKeepsCase() {
        assertEquals(".PNG", FileUtils.getDottedExtension("Logo.PNG"));
        assertEquals("", FileUtils.getDottedExtension("README"));
    }

    @Test
    void testGetBaseName() {
        assertEquals("logo", FileUtils.getBaseName("en/v1/assets/images/logo.png"));
        assertEquals("archive.tar", FileUtils.getBaseName("archive.tar.gz"));
        assertEquals("README", FileUtils.getBaseName("README"));
    }

    @Test
    void testGetFileNameWithBackslashes() {
        assertEquals("logo.png", FileUtils.getFileName("en\\v1\\assets\\logo.png"));
    }

    @Test
    void testJoinUrlPath() {
        assertEquals("/public/assets/en/v1/images/a.png",
                FileUtils.joinUrlPath("public/assets/", "/en", "v1", "images", "a.png"));
        assertEquals("/", FileUtils.joinUrlPath("", null, "/"));
    }

    @Test
    void testSha256HexKnownValue() {
        // SHA-256("abc")
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                FileUtils.sha256Hex("abc".getBytes(StandardCharsets.UTF_8)));
    }
}
