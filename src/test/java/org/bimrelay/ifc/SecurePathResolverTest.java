package org.bimrelay.ifc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurePathResolverTest {

    @TempDir
    Path tempDir;

    private SecurePathResolver resolver(Path... roots) {
        IfcServerProperties properties = new IfcServerProperties();
        properties.setRoots(Arrays.stream(roots).map(Path::toString).toList());
        return new SecurePathResolver(properties);
    }

    @Test
    void resolveIfcFile_acceptsRelativeAndAbsolutePaths() throws Exception {
        Path root = Files.createDirectories(tempDir.resolve("models"));
        Path file = Files.writeString(Files.createDirectories(root.resolve("site")).resolve("Tower.IFC"), "DATA;\nENDSEC;\n");
        SecurePathResolver resolver = resolver(root);

        SecurePathResolver.ResolvedPath relative = resolver.resolveIfcFile(null, "site/Tower.IFC");
        SecurePathResolver.ResolvedPath absolute = resolver.resolveIfcFile(null, file.toString());

        assertThat(relative.rootId()).isEqualTo("root0");
        assertThat(relative.displayPath()).isEqualTo("site/Tower.IFC");
        assertThat(absolute.absolutePath()).isEqualTo(relative.absolutePath());
    }

    @Test
    void resolveIfcFile_picksDeepestRootForAbsolutePath() throws Exception {
        Path outer = Files.createDirectories(tempDir.resolve("outer"));
        Path inner = Files.createDirectories(outer.resolve("inner"));
        Path file = Files.writeString(inner.resolve("a.ifc"), "");

        SecurePathResolver.ResolvedPath resolved = resolver(outer, inner).resolveIfcFile(null, file.toString());

        assertThat(resolved.rootId()).isEqualTo("root1");
        assertThat(resolved.displayPath()).isEqualTo("a.ifc");
        assertThat(resolver(outer, inner).listRoots()).hasSize(2);
    }

    @Test
    void resolveIfcFile_rejectsPathsOutsideRoots() throws Exception {
        Path root = Files.createDirectories(tempDir.resolve("models"));
        Files.writeString(tempDir.resolve("secret.ifc"), "");
        SecurePathResolver resolver = resolver(root);

        assertThatThrownBy(() -> resolver.resolveIfcFile(null, "../secret.ifc"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveIfcFile(null, tempDir.resolve("secret.ifc").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveIfcFile_rejectsMissingDirectoriesAndOtherExtensions() throws Exception {
        Path root = Files.createDirectories(tempDir.resolve("models"));
        Files.writeString(root.resolve("notes.txt"), "");
        Files.createDirectories(root.resolve("dir.ifc"));
        SecurePathResolver resolver = resolver(root);

        assertThatThrownBy(() -> resolver.resolveIfcFile(null, "missing.ifc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveIfcFile(null, "notes.txt")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveIfcFile(null, "dir.ifc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveIfcFile(null, " ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveIfcFile("root9", "notes.txt")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveIfcFile_failsWithoutConfiguredRoots() {
        IfcServerProperties properties = new IfcServerProperties();
        properties.setRoots(List.of());

        assertThatThrownBy(() -> new SecurePathResolver(properties).resolveIfcFile(null, "a.ifc"))
                .isInstanceOf(IllegalStateException.class);
    }
}
