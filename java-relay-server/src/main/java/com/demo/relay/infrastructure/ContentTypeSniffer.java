package com.demo.relay.infrastructure;

import org.springframework.http.MediaType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLConnection;

/**
 * Picks a response content type from the leading bytes of an upload.
 */
public final class ContentTypeSniffer {

    private ContentTypeSniffer() {
    }

    public static MediaType detect(byte[] data) {
        if (startsWith(data, 0x89, 'P', 'N', 'G')) {
            return MediaType.IMAGE_PNG;
        }
        if (startsWith(data, 0xFF, 0xD8, 0xFF)) {
            return MediaType.IMAGE_JPEG;
        }
        if (startsWith(data, 'G', 'I', 'F', '8')) {
            return MediaType.IMAGE_GIF;
        }
        if (startsWith(data, 'R', 'I', 'F', 'F') && data.length >= 12
                && data[8] == 'W' && data[9] == 'E' && data[10] == 'B' && data[11] == 'P') {
            return MediaType.parseMediaType("image/webp");
        }
        if (startsWith(data, 'B', 'M')) {
            return MediaType.parseMediaType("image/bmp");
        }

        String guessed;
        try {
            guessed = URLConnection.guessContentTypeFromStream(new ByteArrayInputStream(data));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return guessed != null ? MediaType.parseMediaType(guessed) : MediaType.APPLICATION_OCTET_STREAM;
    }

    private static boolean startsWith(byte[] data, int... prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((data[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
