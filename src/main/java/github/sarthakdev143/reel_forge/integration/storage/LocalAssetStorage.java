package github.sarthakdev143.reel_forge.integration.storage;

import github.sarthakdev143.reel_forge.config.ReelForgeProperties;
import github.sarthakdev143.reel_forge.model.AssetRef;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Stores assets as flat files under a root directory. References look like {@code local:<uuid>.<ext>}.
 */
@Component
public class LocalAssetStorage implements AssetStorage {

    private static final String SCHEME = "local:";
    private static final Pattern EXTENSION_PATTERN = Pattern.compile("^[a-z0-9]{1,8}$");
    private static final Pattern NAME_PATTERN = Pattern.compile("^[0-9a-f\\-]{36}(\\.[a-z0-9]{1,8})?$");

    private final Path root;

    @Autowired
    public LocalAssetStorage(ReelForgeProperties properties) {
        this(Path.of(properties.storage().root()));
    }

    public LocalAssetStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public AssetRef put(byte[] content, String extension) throws IOException {
        String fileName = newFileName(extension);
        Files.createDirectories(root);
        Files.write(root.resolve(fileName), content);
        return new AssetRef(SCHEME + fileName);
    }

    @Override
    public byte[] get(AssetRef ref) throws IOException {
        return Files.readAllBytes(localPath(ref));
    }

    @Override
    public AssetRef putFile(Path source) throws IOException {
        String fileName = newFileName(extensionOf(source));
        Files.createDirectories(root);
        Files.copy(source, root.resolve(fileName), StandardCopyOption.REPLACE_EXISTING);
        return new AssetRef(SCHEME + fileName);
    }

    @Override
    public Path localPath(AssetRef ref) throws IOException {
        String value = ref.value();
        if (!value.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Not a local asset reference: " + value);
        }

        String fileName = value.substring(SCHEME.length());
        if (!NAME_PATTERN.matcher(fileName).matches()) {
            throw new IllegalArgumentException("Malformed local asset reference: " + value);
        }

        Path path = root.resolve(fileName);
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("Asset not found for reference " + value);
        }
        return path;
    }

    private String newFileName(String extension) {
        String normalized = extension == null ? "" : extension.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            return UUID.randomUUID().toString();
        }
        if (!EXTENSION_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Unsupported asset extension: " + extension);
        }
        return UUID.randomUUID() + "." + normalized;
    }

    private String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1);
    }
}
