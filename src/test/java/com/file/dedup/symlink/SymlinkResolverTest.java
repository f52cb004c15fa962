package com.file.dedup.symlink;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SymlinkResolverTest {

    @TempDir
    Path tempDir;

    private Path target;

    @BeforeEach
    void setUp() throws IOException {
        target = Files.writeString(tempDir.resolve("target.txt"), "content");
    }

    @Nested
    @DisplayName("Plain paths")
    class PlainPathTests {

        @Test
        @DisplayName("A regular file resolves to itself")
        void testRegularFile() {
            SymlinkResolution resolution = new SymlinkResolver().resolveWithReason(target);
            assertTrue(resolution.isResolved());
            assertEquals(target.toAbsolutePath().normalize(), resolution.target());
            assertEquals(0, resolution.hops());
        }

        @Test
        @DisplayName("A missing file does not resolve")
        void testMissing() {
            SymlinkResolution resolution = new SymlinkResolver().resolveWithReason(tempDir.resolve("nope.txt"));
            assertFalse(resolution.isResolved());
            assertEquals(SymlinkFailure.NOT_FOUND, resolution.failure());
        }
    }

    @Nested
    @DisplayName("Link chains")
    class ChainTests {

        @Test
        @DisplayName("Should follow a relative link to its target")
        void testRelativeLink() throws IOException {
            Path link = Files.createSymbolicLink(tempDir.resolve("link.txt"), Path.of("target.txt"));

            Optional<Path> resolved = new SymlinkResolver().resolve(link);

            assertTrue(resolved.isPresent());
            assertEquals(target.toRealPath(), resolved.get());
        }

        @Test
        @DisplayName("Should follow a chain up to the maximum depth")
        void testChainWithinDepth() throws IOException {
            Path l1 = Files.createSymbolicLink(tempDir.resolve("l1"), target);
            Path l2 = Files.createSymbolicLink(tempDir.resolve("l2"), l1);
            Path l3 = Files.createSymbolicLink(tempDir.resolve("l3"), l2);

            SymlinkResolution resolution = new SymlinkResolver(SymlinkConfig.defaults().withMaxDepth(3))
                    .resolveWithReason(l3);

            assertTrue(resolution.isResolved());
            assertEquals(3, resolution.hops());
        }

        @Test
        @DisplayName("Should fail a chain longer than the maximum depth")
        void testDepthExceeded() throws IOException {
            Path l1 = Files.createSymbolicLink(tempDir.resolve("l1"), target);
            Path l2 = Files.createSymbolicLink(tempDir.resolve("l2"), l1);
            Path l3 = Files.createSymbolicLink(tempDir.resolve("l3"), l2);

            SymlinkResolution resolution = new SymlinkResolver(SymlinkConfig.defaults().withMaxDepth(2))
                    .resolveWithReason(l3);

            assertFalse(resolution.isResolved());
            assertEquals(SymlinkFailure.DEPTH_EXCEEDED, resolution.failure());
        }

        @Test
        @DisplayName("Should detect a cycle")
        void testCycle() throws IOException {
            Path a = tempDir.resolve("a");
            Path b = tempDir.resolve("b");
            Files.createSymbolicLink(a, b);
            Files.createSymbolicLink(b, a);

            SymlinkResolution resolution = new SymlinkResolver().resolveWithReason(a);

            assertEquals(SymlinkFailure.CIRCULAR_REFERENCE, resolution.failure());
            assertTrue(new SymlinkResolver().resolve(b).isEmpty());
        }

        @Test
        @DisplayName("Should report a dangling link as not found")
        void testDangling() throws IOException {
            Path link = Files.createSymbolicLink(tempDir.resolve("dangling"), tempDir.resolve("gone.txt"));

            assertEquals(SymlinkFailure.NOT_FOUND, new SymlinkResolver().resolveWithReason(link).failure());
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigTests {

        @Test
        @DisplayName("Should refuse targets outside the boundary")
        void testContainment() throws IOException {
            Path inner = Files.createDirectory(tempDir.resolve("inner"));
            Path link = Files.createSymbolicLink(inner.resolve("escape.txt"), target);

            SymlinkResolver resolver = new SymlinkResolver(SymlinkConfig.defaults().withBoundary(inner));

            assertEquals(SymlinkFailure.CONTAINMENT_VIOLATION, resolver.resolveWithReason(link).failure());
        }

        @Test
        @DisplayName("Should refuse a target reached through a directory link that leaves the boundary")
        void testContainmentThroughDirectoryLink() throws IOException {
            Path boundary = Files.createDirectory(tempDir.resolve("boundary"));
            Path outside = Files.createDirectory(tempDir.resolve("outside"));
            Files.writeString(outside.resolve("secret.txt"), "secret");
            Files.createSymbolicLink(boundary.resolve("dirlink"), outside);
            Path link = Files.createSymbolicLink(boundary.resolve("innocent.txt"), Path.of("dirlink/secret.txt"));

            SymlinkResolution resolution = new SymlinkResolver(SymlinkConfig.defaults().withBoundary(boundary))
                    .resolveWithReason(link);

            assertFalse(resolution.isResolved());
            assertEquals(SymlinkFailure.CONTAINMENT_VIOLATION, resolution.failure());
        }

        @Test
        @DisplayName("Should refuse a parent step taken after a directory link")
        void testContainmentThroughParentStep() throws IOException {
            Path boundary = Files.createDirectory(tempDir.resolve("boundary"));
            Path deep = Files.createDirectories(tempDir.resolve("outside/deep"));
            Files.writeString(deep.getParent().resolve("secret.txt"), "secret");
            Files.createSymbolicLink(boundary.resolve("dirlink"), deep);
            Path link = Files.createSymbolicLink(boundary.resolve("innocent.txt"), Path.of("dirlink/../secret.txt"));

            SymlinkResolution resolution = new SymlinkResolver(SymlinkConfig.defaults().withBoundary(boundary))
                    .resolveWithReason(link);

            assertEquals(SymlinkFailure.CONTAINMENT_VIOLATION, resolution.failure());
        }

        @Test
        @DisplayName("Should allow a directory link that stays inside the boundary")
        void testDirectoryLinkInsideBoundary() throws IOException {
            Path boundary = Files.createDirectory(tempDir.resolve("boundary"));
            Path docs = Files.createDirectory(boundary.resolve("docs"));
            Path file = Files.writeString(docs.resolve("notes.txt"), "notes");
            Files.createSymbolicLink(boundary.resolve("dirlink"), docs);
            Path link = Files.createSymbolicLink(boundary.resolve("shortcut.txt"), Path.of("dirlink/notes.txt"));

            SymlinkResolution resolution = new SymlinkResolver(SymlinkConfig.defaults().withBoundary(boundary))
                    .resolveWithReason(link);

            assertTrue(resolution.isResolved());
            assertEquals(file.toRealPath(), resolution.target());
        }

        @Test
        @DisplayName("Should allow targets inside the boundary")
        void testInsideBoundary() throws IOException {
            Path link = Files.createSymbolicLink(tempDir.resolve("ok.txt"), target);

            SymlinkResolver resolver = new SymlinkResolver(SymlinkConfig.defaults().withBoundary(tempDir));

            assertTrue(resolver.resolve(link).isPresent());
        }

        @Test
        @DisplayName("Should not follow links when disabled")
        void testNoFollow() throws IOException {
            Path link = Files.createSymbolicLink(tempDir.resolve("link.txt"), target);
            SymlinkResolver resolver = new SymlinkResolver(SymlinkConfig.noFollow());

            assertEquals(SymlinkFailure.NOT_FOLLOWED, resolver.resolveWithReason(link).failure());
            assertTrue(resolver.resolve(target).isPresent());
        }

        @Test
        @DisplayName("Should reject a non-positive depth")
        void testInvalidDepth() {
            assertThrows(IllegalArgumentException.class, () -> SymlinkConfig.defaults().withMaxDepth(0));
        }
    }
}
