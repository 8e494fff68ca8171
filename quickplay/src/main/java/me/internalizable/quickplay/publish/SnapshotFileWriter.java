package me.internalizable.quickplay.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.internalizable.quickplay.api.snapshot.PublishedServer;
import me.internalizable.quickplay.classify.ClassificationResult;
import me.internalizable.quickplay.stats.PopulationStats;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes the local snapshot, rejection and statistics artifacts as indented JSON.
 *
 * <p>Files are written to a sibling temporary file and moved into place, so a
 * reader never sees a partial artifact.</p>
 */
public final class SnapshotFileWriter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path snapshotFile;
    private final Path rejectionsFile;
    private final Path statsFile;

    public SnapshotFileWriter(@Nonnull Path snapshotFile, @Nonnull Path rejectionsFile, @Nonnull Path statsFile) {
        this.snapshotFile = Objects.requireNonNull(snapshotFile, "snapshotFile");
        this.rejectionsFile = Objects.requireNonNull(rejectionsFile, "rejectionsFile");
        this.statsFile = Objects.requireNonNull(statsFile, "statsFile");
    }

    public void writeServers(@Nonnull List<PublishedServer> servers) throws IOException {
        write(snapshotFile, SnapshotJson.servers(mapper, servers));
    }

    public void writeRejections(@Nonnull List<ClassificationResult.Rejected> rejections) throws IOException {
        write(rejectionsFile, SnapshotJson.rejections(mapper, rejections));
    }

    public void writeStats(@Nonnull PopulationStats stats) throws IOException {
        write(statsFile, SnapshotJson.stats(mapper, stats));
    }

    @Nonnull
    public Path getSnapshotFile() {
        return snapshotFile;
    }

    @Nonnull
    public Path getRejectionsFile() {
        return rejectionsFile;
    }

    @Nonnull
    public Path getStatsFile() {
        return statsFile;
    }

    private void write(Path file, JsonNode tree) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), tree);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
