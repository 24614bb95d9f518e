package it.unimib.datai.lambdagateway.gateway.deploy;

import it.unimib.datai.lambdagateway.common.model.DeploySpec;
import it.unimib.datai.lambdagateway.common.platform.FunctionArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZipCodeBundlerTest {

    @TempDir
    Path tempDir;

    private final ZipCodeBundler bundler = new ZipCodeBundler();

    @Test
    void singleFile_isStoredAtRootAndNamesTheHandlerModule() throws IOException {
        Path file = Files.writeString(tempDir.resolve("foo.js"), "exports.handler = async () => 'ok';");

        FunctionArtifact artifact = bundler.bundle("foo", DeploySpec.of(file.toString(), "handler"));

        assertThat(artifact.functionName()).isEqualTo("foo");
        assertThat(artifact.handler()).isEqualTo("foo.handler");
        assertThat(entries(artifact.archive())).containsExactly("foo.js");
        assertThat(artifact.deploySpec().source()).isEqualTo(file.toString());
    }

    @Test
    void directory_isZippedRecursivelyWithIndexModule() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("fn"));
        Files.writeString(dir.resolve("index.js"), "exports.main = require('./lib/util').main;");
        Files.createDirectories(dir.resolve("lib"));
        Files.writeString(dir.resolve("lib/util.js"), "exports.main = async () => 'ok';");

        FunctionArtifact artifact = bundler.bundle("fn", DeploySpec.of(dir.toString(), "main"));

        assertThat(artifact.handler()).isEqualTo("index.main");
        assertThat(entries(artifact.archive())).containsExactly("index.js", "lib/util.js");
        assertThat(artifact.size()).isPositive();
    }

    @Test
    void missingSource_fails() {
        DeploySpec spec = DeploySpec.of(tempDir.resolve("missing.js").toString(), "handler");

        assertThatThrownBy(() -> bundler.bundle("foo", spec)).isInstanceOf(NoSuchFileException.class);
    }

    private static List<String> entries(byte[] archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
