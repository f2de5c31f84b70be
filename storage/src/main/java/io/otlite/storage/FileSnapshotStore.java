// file: src/main/java/io/otlite/storage/FileSnapshotStore.java
package io.otlite.storage;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Binary snapshot store backed by one file per document.
 * <p>
 * File name: {@code doc-<base64url(documentId)>.snap}, so any id is a
 * legal file name.
 * <p>
 * Format:
 *   int32 magic   (0x4F54534E, "OTSN")
 *   int32 format  (1)
 *   documentId:   int32 len + UTF-8 bytes
 *   version:      int64
 *   content:      int32 len + UTF-8 bytes
 * <p>
 * Atomicity:
 *   - We write to "doc-...snap.tmp" first,
 *   - then move over "doc-...snap" using ATOMIC_MOVE.
 *   A reader sees either the old snapshot or the new one, never a torn file.
 */
public final class FileSnapshotStore implements SnapshotStore {
    private static final int MAGIC = 0x4F54534E;
    private static final int FORMAT = 1;

    private final Path dir;

    public FileSnapshotStore(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public void write(DocumentSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        Path dst = fileFor(snapshot.documentId());
        Path tmp = dst.resolveSibling(dst.getFileName() + ".tmp");

        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
            out.writeInt(MAGIC);
            out.writeInt(FORMAT);
            writeString(out, snapshot.documentId());
            out.writeLong(snapshot.version());
            writeString(out, snapshot.content());
        } catch (IOException e) {
            throw new UncheckedIOException("snapshot write failed for " + snapshot.documentId(), e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("snapshot publish failed for " + snapshot.documentId(), e);
        }
    }

    @Override
    public Optional<DocumentSnapshot> load(String documentId) {
        Objects.requireNonNull(documentId, "documentId");
        Path src = fileFor(documentId);
        try (var in = new DataInputStream(Files.newInputStream(src))) {
            if (in.readInt() != MAGIC) {
                throw new IOException("not a snapshot file: " + src);
            }
            int format = in.readInt();
            if (format != FORMAT) {
                throw new IOException("unsupported snapshot format " + format + " in " + src);
            }
            String storedId = readString(in);
            if (!storedId.equals(documentId)) {
                throw new IOException("snapshot " + src + " belongs to " + storedId);
            }
            long version = in.readLong();
            String content = readString(in);
            return Optional.of(new DocumentSnapshot(storedId, content, version));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("snapshot read failed for " + documentId, e);
        }
    }

    Path fileFor(String documentId) {
        String encoded = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(documentId.getBytes(StandardCharsets.UTF_8));
        return dir.resolve("doc-" + encoded + ".snap");
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len < 0) {
            throw new IOException("negative string length " + len);
        }
        byte[] b = in.readNBytes(len);
        if (b.length != len) {
            throw new IOException("truncated snapshot: wanted " + len + " bytes, got " + b.length);
        }
        return new String(b, StandardCharsets.UTF_8);
    }
}
