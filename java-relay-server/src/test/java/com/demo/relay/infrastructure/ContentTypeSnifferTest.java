package com.demo.relay.infrastructure;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ContentTypeSnifferTest {

    @Test
    void detectsCommonImageFormats() {
        assertEquals(MediaType.IMAGE_PNG, ContentTypeSniffer.detect(new byte[]{(byte) 0x89, 'P', 'N', 'G', 1}));
        assertEquals(MediaType.IMAGE_JPEG, ContentTypeSniffer.detect(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0}));
        assertEquals(MediaType.IMAGE_GIF, ContentTypeSniffer.detect("GIF89a".getBytes(StandardCharsets.US_ASCII)));
        assertEquals("image/webp",
                ContentTypeSniffer.detect("RIFF\0\0\0\0WEBPVP8 ".getBytes(StandardCharsets.US_ASCII)).toString());
    }

    @Test
    void unknownBytesAreOctetStream() {
        assertEquals(MediaType.APPLICATION_OCTET_STREAM, ContentTypeSniffer.detect(new byte[]{1, 2, 3}));
        assertEquals(MediaType.APPLICATION_OCTET_STREAM, ContentTypeSniffer.detect(new byte[0]));
    }
}
