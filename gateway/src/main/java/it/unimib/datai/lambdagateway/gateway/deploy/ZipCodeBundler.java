package it.unimib.datai.lambdagateway.gateway.deploy;

import it.unimib.datai.lambdagateway.common.model.DeploySpec;
import it.unimib.datai.lambdagateway.common.platform.FunctionArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Zips the deploy source into an in-memory archive.
 * <p>
 * A file source is stored at the archive root and its base name becomes the handler module.
 * A directory source is stored recursively and must contain the {@code index} entry module.
 */
public class ZipCodeBundler implements CodeBundler {
    private static final Logger log = LoggerFactory.getLogger(ZipCodeBundler.class);
    private static final String DIRECTORY_ENTRY_MODULE = "index";

    @Override
    public FunctionArtifact bundle(String functionName, DeploySpec spec) throws IOException {
        Path source = Path.of(spec.source());
        if (!Files.exists(source)) {
            throw new NoSuchFileException(spec.source());
        }

        String module;
        byte[] archive;
        if (Files.isDirectory(source)) {
            module = DIRECTORY_ENTRY_MODULE;
            archive = zipDirectory(source);
        } else {
            module = stripExtension(source.getFileName().toString());
            archive = zipFiles(source.getParent(), List.of(source));
        }

        String handler = module + "." + spec.export();
        log.info("Bundled {} for function {} ({} bytes, handler {})", source, functionName, archive.length, handler);
        return new FunctionArtifact(functionName, handler, archive, spec);
    }

    private byte[] zipDirectory(Path root) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        return zipFiles(root, files);
    }

    private byte[] zipFiles(Path root, List<Path> files) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (Path file : files) {
                String name = root == null
                        ? file.getFileName().toString()
                        : root.relativize(file).toString().replace('\\', '/');
                zip.putNextEntry(new ZipEntry(name));
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
