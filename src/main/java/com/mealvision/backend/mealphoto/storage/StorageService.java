package com.mealvision.backend.mealphoto.storage;

import java.io.InputStream;

/** 照片來源：photoPath 就是 objectKey */
public interface StorageService {

    OpenResult open(String objectKey) throws Exception;

    record OpenResult(InputStream inputStream, long sizeBytes, String contentType) {}
}
