package com.nhoyhub.order.service;

import com.nhoyhub.order.config.OrderApiProperties;
import com.nhoyhub.order.exception.ImageNotFoundException;
import com.nhoyhub.order.exception.StorageException;
import com.nhoyhub.order.metrics.OrderMetrics;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Flat directory of uploaded order images.
 * <p>
 * Stored names are {@code order_<id>_<8 hex>_<original name>}; bytes are written as received.
 * Lookups for a missing name fall back to the placeholder file.
 */
@Slf4j
@Service
public class ImageStorageService {

    public static final String URL_PREFIX = "/images/";

    private static final String FALLBACK_HINT = "upload";

    private final Path root;
    private final OrderApiProperties.Storage storage;
    private final OrderMetrics orderMetrics;

    public ImageStorageService(OrderApiProperties properties, OrderMetrics orderMetrics) {
        this.storage = properties.getStorage();
        this.root = Paths.get(storage.getUploadDir()).toAbsolutePath().normalize();
        this.orderMetrics = orderMetrics;
    }

    @PostConstruct
    public void initialize() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Could not create image directory " + root, e);
        }

        Path placeholder = root.resolve(storage.getPlaceholderName());
        if (Files.exists(placeholder)) {
            return;
        }
        try {
            Files.writeString(placeholder, storage.getPlaceholderContent(), StandardCharsets.UTF_8);
            log.info("Created placeholder image: {}", placeholder);
        } catch (IOException e) {
            log.warn("Could not create placeholder image {}", placeholder, e);
        }
    }

    /**
     * Writes the upload and returns its server-relative URL.
     *
     * @throws StorageException if the file cannot be written
     */
    public String save(MultipartFile file, long orderId) {
        String filename = String.format("order_%d_%s_%s",
                orderId, UUID.randomUUID().toString().replace("-", "").substring(0, 8), filenameHint(file));
        Path target = root.resolve(filename);

        try (InputStream in = file.getInputStream()) {
            // the directory may have been removed since start-up
            Files.createDirectories(root);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Failed to store image {} for order {}", filename, orderId, e);
            throw new StorageException("Could not save uploaded file", e);
        }

        log.info("Stored image {} ({} bytes) for order {}", filename, file.getSize(), orderId);
        return URL_PREFIX + filename;
    }

    /**
     * Returns the named image, or the placeholder when it is missing.
     *
     * @throws ImageNotFoundException if neither exists
     */
    public Resource load(String filename) {
        Path requested = resolveInsideRoot(filename);
        if (requested != null && Files.isRegularFile(requested)) {
            return new FileSystemResource(requested);
        }

        Path placeholder = root.resolve(storage.getPlaceholderName());
        if (Files.isRegularFile(placeholder)) {
            log.debug("Image {} not found, serving placeholder", filename);
            orderMetrics.incrementPlaceholderServed();
            return new FileSystemResource(placeholder);
        }

        log.warn("Image {} not found and no placeholder available", filename);
        throw new ImageNotFoundException(filename);
    }

    private Path resolveInsideRoot(String filename) {
        try {
            Path resolved = root.resolve(filename).normalize();
            return resolved.startsWith(root) ? resolved : null;
        } catch (InvalidPathException e) {
            log.debug("Invalid image name: {}", filename, e);
            return null;
        }
    }

    private static String filenameHint(MultipartFile file) {
        String original = file.getOriginalFilename();
        if (!StringUtils.hasText(original)) {
            return FALLBACK_HINT;
        }
        // browsers may send a full client-side path
        String name = StringUtils.getFilename(StringUtils.cleanPath(original.replace('\\', '/')));
        return StringUtils.hasText(name) && !"..".equals(name) ? name : FALLBACK_HINT;
    }
}
