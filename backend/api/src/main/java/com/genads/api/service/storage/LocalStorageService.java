package com.genads.api.service.storage;

import com.genads.common.exception.ApiException;
import com.genads.common.exception.ErrorCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes uploads into a server-local staging directory under their original
 * filename. Same-named uploads overwrite each other.
 */
@Slf4j
@Service
public class LocalStorageService implements StorageService {

    @Getter
    private final Path stagingDir;
    private final String publicPath;

    public LocalStorageService(@Value("${genads.upload.dir:/tmp/uploads}") String uploadDir,
                               @Value("${genads.upload.public-path:/uploads}") String publicPath) {
        this.stagingDir = Paths.get(uploadDir).toAbsolutePath().normalize();
        this.publicPath = publicPath;
        try {
            Files.createDirectories(stagingDir);
            log.info("LocalStorageService initialized - path: {}", stagingDir);
        } catch (IOException e) {
            log.error("Failed to create upload staging directory: {}", stagingDir, e);
        }
    }

    @Override
    public String upload(String filename, InputStream inputStream) {
        Path target = resolve(filename);
        try {
            Files.createDirectories(stagingDir);
            Files.copy(inputStream, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("File saved locally: {}", target);
            return publicPath + "/" + filename;
        } catch (IOException e) {
            log.error("Failed to save file locally: {}", filename, e);
            throw new ApiException(ErrorCode.UPLOAD_FAILED, "Failed to store " + filename, e);
        }
    }

    /**
     * Rejects names that are empty or would land outside the staging directory.
     */
    Path resolve(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new ApiException(ErrorCode.INVALID_UPLOAD, "Filename is required");
        }

        Path target;
        try {
            target = stagingDir.resolve(filename).normalize();
        } catch (RuntimeException e) {
            throw new ApiException(ErrorCode.INVALID_UPLOAD, "Invalid filename");
        }

        if (!stagingDir.equals(target.getParent())) {
            log.warn("[LocalStorage] Rejected filename outside staging dir: {}", filename);
            throw new ApiException(ErrorCode.INVALID_UPLOAD, "Invalid filename");
        }
        return target;
    }
}
