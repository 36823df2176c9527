package com.acme.leadflow.audit;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Appends complete lines to a file. Implementations may leave a partial write behind when
 * they throw; callers restore the file size before retrying.
 */
@FunctionalInterface
public interface LineAppender {

    /**
     * Encodes the whole call into one buffer and appends it through a single channel. On
     * failure the file is truncated back to its size before the call.
     */
    LineAppender FILE = (file, lines) -> {
        StringBuilder sb = new StringBuilder(lines.size() * 256);
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        ByteBuffer buffer = ByteBuffer.wrap(sb.toString().getBytes(StandardCharsets.UTF_8));
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            long start = channel.size();
            channel.position(start);
            try {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            } catch (IOException e) {
                try {
                    channel.truncate(start);
                } catch (IOException truncateFailure) {
                    e.addSuppressed(truncateFailure);
                }
                throw e;
            }
        }
    };

    void append(Path file, List<String> lines) throws IOException;
}
