package com.mealvision.backend.mealphoto.image;

import java.util.Optional;

/** 只看 magic bytes，不信任副檔名或 probeContentType */
public final class ImageSniffer {

    private ImageSniffer() {}

    public enum ImageType { JPEG, PNG }

    private static final byte[] PNG_SIG = {
            (byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A
    };

    public static Optional<ImageType> detect(byte[] head) {
        if (head == null || head.length < 2) return Optional.empty();

        if (startsWith(head, PNG_SIG)) return Optional.of(ImageType.PNG);

        // JPEG：FF D8 FF
        if (head.length >= 3 && head[0] == (byte) 0xFF && head[1] == (byte) 0xD8 && head[2] == (byte) 0xFF) {
            return Optional.of(ImageType.JPEG);
        }

        return Optional.empty();
    }

    private static boolean startsWith(byte[] buf, byte[] prefix) {
        if (buf.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (buf[i] != prefix[i]) return false;
        }
        return true;
    }
}
