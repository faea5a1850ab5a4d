package com.mealvision.backend.mealphoto.storage;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

@Getter
@Service
public class LocalDiskStorageService implements StorageService {

    private final Path baseDir;

    public LocalDiskStorageService(@Value("${app.storage.local.base-dir:./uploads/meal_photos}") String baseDir) {
        this.baseDir = Paths.get(baseDir).toAbsolutePath().normalize();
    }

    @Override
    public OpenResult open(String objectKey) throws Exception {
        Path path = resolve(objectKey);
        if (!Files.isRegularFile(path)) throw new FileNotFoundException("Image file not found: " + objectKey);

        String ct = Files.probeContentType(path);
        long size = Files.size(path);
        InputStream in = Files.newInputStream(path, StandardOpenOption.READ);
        return new OpenResult(in, size, ct);
    }

    /** 相對路徑以 baseDir 為根；絕對路徑也必須落在 baseDir 底下 */
    private Path resolve(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) throw new IllegalArgumentException("PHOTO_PATH_MISSING");
        Path p = baseDir.resolve(objectKey).normalize();
        if (!p.startsWith(baseDir)) throw new SecurityException("Invalid photo path: " + objectKey);
        return p;
    }
}
