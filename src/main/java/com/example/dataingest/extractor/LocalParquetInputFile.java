package com.example.dataingest.extractor;

import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.parquet.io.DelegatingSeekableInputStream;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

/**
 * Parquet {@link InputFile} over a local file, so footers are read without a Hadoop filesystem.
 */
final class LocalParquetInputFile implements InputFile {

    private final Path file;

    LocalParquetInputFile(Path file) {
        this.file = file;
    }

    @Override
    public long getLength() throws IOException {
        return Files.size(file);
    }

    @Override
    public SeekableInputStream newStream() throws IOException {
        return new ChannelInputStream(Files.newByteChannel(file));
    }

    @Override
    public String toString() {
        return file.toString();
    }

    /**
     * Reads straight from the channel; seeking moves the channel position.
     */
    private static final class ChannelInputStream extends DelegatingSeekableInputStream {

        private final SeekableByteChannel channel;

        private ChannelInputStream(SeekableByteChannel channel) {
            super(Channels.newInputStream(channel));
            this.channel = channel;
        }

        @Override
        public long getPos() throws IOException {
            return channel.position();
        }

        @Override
        public void seek(long newPos) throws IOException {
            if (newPos < 0) {
                throw new IOException("Negative seek position: " + newPos);
            }
            channel.position(newPos);
        }
    }
}
