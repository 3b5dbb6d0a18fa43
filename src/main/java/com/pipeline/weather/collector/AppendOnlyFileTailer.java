package com.pipeline.weather.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 追加写文件的增量读取器。
 *
 * 只消费以换行结尾的完整行，末尾未写完的行留到下次读取。
 * 文件变短（轮转或截断）时从头重新读取。
 * 读取位置分为已提交和待提交两部分，commit 前移、rewind 回退。
 */
public class AppendOnlyFileTailer {

    private static final Logger log = LoggerFactory.getLogger(AppendOnlyFileTailer.class);

    /** 单次读取的默认上限：64 MiB */
    public static final int DEFAULT_MAX_READ_BYTES = 64 * 1024 * 1024;

    private static final int SCAN_CHUNK_BYTES = 64 * 1024;

    private final Path file;
    private final int maxReadBytes;

    private long committedOffset = 0;
    private long committedLines = 0;
    private long pendingOffset = 0;
    private long pendingLines = 0;
    private boolean readFromStart = false;

    public AppendOnlyFileTailer(Path file) {
        this(file, DEFAULT_MAX_READ_BYTES);
    }

    public AppendOnlyFileTailer(Path file, int maxReadBytes) {
        if (maxReadBytes <= 0) {
            throw new IllegalArgumentException("Max read bytes must be positive, got: " + maxReadBytes);
        }
        this.file = file;
        this.maxReadBytes = maxReadBytes;
    }

    /**
     * 读取已提交位置之后的完整行，单次最多读取 maxReadBytes 字节。
     * 积压超过上限时只返回上限内最后一个换行之前的行，其余留给下一次读取。
     * 单行超过上限时返回截断后的前缀，并跳到该行的换行之后。
     *
     * @return 新增行（含行号）；文件不存在或无新内容时返回空列表
     */
    public List<Line> readNewLines() throws IOException {
        pendingOffset = committedOffset;
        pendingLines = committedLines;
        readFromStart = false;

        if (!Files.exists(file)) {
            log.debug("Input file {} does not exist yet", file);
            return Collections.emptyList();
        }

        long size = Files.size(file);
        if (size < committedOffset) {
            log.warn("Input file {} shrank from {} to {} bytes, re-reading from the start",
                    file, committedOffset, size);
            committedOffset = 0;
            committedLines = 0;
            pendingOffset = 0;
            pendingLines = 0;
        }
        if (size == committedOffset) {
            return Collections.emptyList();
        }
        readFromStart = committedOffset == 0;

        long end = Math.min(size, committedOffset + maxReadBytes);
        byte[] bytes = readRange(committedOffset, end);
        int lastNewline = -1;
        for (int i = bytes.length - 1; i >= 0; i--) {
            if (bytes[i] == '\n') {
                lastNewline = i;
                break;
            }
        }
        if (lastNewline < 0) {
            if (bytes.length < maxReadBytes) {
                return Collections.emptyList();
            }
            return oversizedLine(bytes, size);
        }

        String text = new String(bytes, 0, lastNewline, StandardCharsets.UTF_8);
        List<Line> lines = new ArrayList<>();
        long lineNumber = committedLines;
        for (String raw : text.split("\n", -1)) {
            lineNumber++;
            String line = stripCarriageReturn(raw);
            if (!line.trim().isEmpty()) {
                lines.add(new Line(lineNumber, line));
            }
        }

        if (end < size) {
            log.debug("Read capped at {} bytes of {}, the rest of {} is left for the next read",
                    maxReadBytes, size - committedOffset, file);
        }
        pendingOffset = committedOffset + lastNewline + 1;
        pendingLines = lineNumber;
        return lines;
    }

    /**
     * 上限内没有换行：找到该行的结尾，返回截断的前缀，行尚未写完时返回空列表
     */
    private List<Line> oversizedLine(byte[] prefix, long size) throws IOException {
        long newline = findNewline(committedOffset + prefix.length, size);
        if (newline < 0) {
            log.debug("Line at offset {} of {} exceeds {} bytes and is not complete yet",
                    committedOffset, file, maxReadBytes);
            return Collections.emptyList();
        }
        long lineNumber = committedLines + 1;
        log.warn("Line {} of {} is {} bytes long, exceeding the read limit of {} bytes; truncated",
                lineNumber, file, newline - committedOffset, maxReadBytes);
        pendingOffset = newline + 1;
        pendingLines = lineNumber;
        String text = stripCarriageReturn(new String(prefix, StandardCharsets.UTF_8));
        return Collections.singletonList(new Line(lineNumber, text));
    }

    private long findNewline(long from, long to) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(SCAN_CHUNK_BYTES);
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long position = from;
            channel.position(position);
            while (position < to) {
                buffer.clear();
                int read = channel.read(buffer);
                if (read <= 0) {
                    break;
                }
                int limit = (int) Math.min(read, to - position);
                for (int i = 0; i < limit; i++) {
                    if (buffer.get(i) == '\n') {
                        return position + i;
                    }
                }
                position += read;
            }
        }
        return -1;
    }

    private static String stripCarriageReturn(String raw) {
        return raw.endsWith("\r") ? raw.substring(0, raw.length() - 1) : raw;
    }

    public void commit() {
        committedOffset = pendingOffset;
        committedLines = pendingLines;
    }

    public void rewind() {
        pendingOffset = committedOffset;
        pendingLines = committedLines;
    }

    private byte[] readRange(long from, long to) throws IOException {
        int length = (int) (to - from);
        ByteBuffer buffer = ByteBuffer.allocate(length);
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            channel.position(from);
            int read;
            do {
                read = channel.read(buffer);
            } while (read > 0 && buffer.hasRemaining());
        }
        if (buffer.position() < length) {
            byte[] partial = new byte[buffer.position()];
            System.arraycopy(buffer.array(), 0, partial, 0, partial.length);
            return partial;
        }
        return buffer.array();
    }

    public Path getFile() { return file; }
    public long getCommittedOffset() { return committedOffset; }
    public int getMaxReadBytes() { return maxReadBytes; }

    /** 最近一次读取是否从文件开头开始（首次读取或文件被截断后） */
    public boolean isReadFromStart() { return readFromStart; }

    /**
     * 一行文本及其在文件中的行号（从1开始）
     */
    public static final class Line {
        private final long number;
        private final String text;

        public Line(long number, String text) {
            this.number = number;
            this.text = text;
        }

        public long getNumber() { return number; }
        public String getText() { return text; }
    }
}
