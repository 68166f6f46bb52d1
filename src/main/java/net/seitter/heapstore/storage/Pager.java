package net.seitter.heapstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Raw fixed-size page I/O over one physical file.
 *
 * <p>The file holds nothing but pages: page {@code n} occupies bytes
 * {@code [n * pageSize, (n + 1) * pageSize)} and the page count is always
 * {@code fileSize / pageSize}. New pages are appended at the end of the file and
 * page numbers are never reused. The pager does no caching of its own; every call
 * is a synchronous file operation.
 */
public class Pager {
    private static final Logger logger = LoggerFactory.getLogger(Pager.class);

    private final Path path;
    private final String fileName;
    private final int pageSize;
    private final RandomAccessFile file;
    private final FileChannel channel;
    private boolean closed;

    /**
     * Opens the page file at the given path, creating an empty file if it does not exist.
     *
     * @param path The file path
     * @param pageSize The page size in bytes
     * @throws IOException If the file cannot be opened, or its size is not a multiple of the page size
     */
    public Pager(Path path, int pageSize) throws IOException {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.path = path;
        this.fileName = path.getFileName().toString();
        this.pageSize = pageSize;

        boolean fileExists = Files.exists(path);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        this.file = new RandomAccessFile(path.toFile(), "rw");
        this.channel = file.getChannel();

        long length = file.length();
        if (length % pageSize != 0) {
            close();
            throw new StorageException(ErrorKind.PAGE_FORMAT, "Size of " + path + " (" + length +
                    " bytes) is not a multiple of the page size " + pageSize);
        }

        if (fileExists) {
            logger.info("Opened page file {} with {} pages", path, length / pageSize);
        } else {
            logger.info("Created page file {}", path);
        }
    }

    /**
     * Extends the file by one zero-filled page.
     *
     * @return The number of the new page
     * @throws IOException If the file could not be extended
     */
    public int allocatePage() throws IOException {
        ensureOpen();
        int pageNumber = getPageCount();
        long offset = (long) pageNumber * pageSize;
        try {
            writeFully(ByteBuffer.allocate(pageSize), offset);
        } catch (IOException e) {
            throw new StorageException(ErrorKind.ALLOCATION,
                    "Failed to extend " + fileName + " with page " + pageNumber, e);
        }
        logger.debug("Allocated page {} in {}", pageNumber, fileName);
        return pageNumber;
    }

    /**
     * Reads one page.
     *
     * @param pageNumber The page number
     * @return Exactly {@code pageSize} bytes
     * @throws IOException If the page does not exist or the read fails
     */
    public byte[] readPage(int pageNumber) throws IOException {
        ensureOpen();
        checkRange(pageNumber);

        ByteBuffer buffer = ByteBuffer.allocate(pageSize);
        long offset = (long) pageNumber * pageSize;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset + buffer.position());
            if (read < 0) {
                throw new StorageException(ErrorKind.OUT_OF_RANGE, "Unexpected end of " + fileName +
                        " while reading page " + pageNumber);
            }
        }
        return buffer.array();
    }

    /**
     * Overwrites one previously allocated page.
     *
     * @param pageNumber The page number
     * @param data Exactly {@code pageSize} bytes
     * @throws IOException If the page has not been allocated or the write fails
     */
    public void writePage(int pageNumber, byte[] data) throws IOException {
        ensureOpen();
        if (data.length != pageSize) {
            throw new IllegalArgumentException("Page data must be " + pageSize + " bytes, got " + data.length);
        }
        checkRange(pageNumber);
        writeFully(ByteBuffer.wrap(data), (long) pageNumber * pageSize);
    }

    /**
     * Gets the number of pages, derived from the file size.
     *
     * @return The page count
     * @throws IOException If the file size cannot be read
     */
    public int getPageCount() throws IOException {
        ensureOpen();
        return (int) (channel.size() / pageSize);
    }

    /**
     * Forces written pages to the storage device.
     *
     * @throws IOException If the force fails
     */
    public void sync() throws IOException {
        ensureOpen();
        channel.force(true);
    }

    /**
     * Closes the file. Further calls fail with {@link IllegalStateException}.
     *
     * @throws IOException If closing fails
     */
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.close();
        } finally {
            file.close();
        }
        logger.info("Closed page file {}", path);
    }

    public boolean isClosed() {
        return closed;
    }

    public Path getPath() {
        return path;
    }

    public String getFileName() {
        return fileName;
    }

    public int getPageSize() {
        return pageSize;
    }

    /**
     * Builds the identifier of a page of this file.
     *
     * @param pageNumber The page number
     * @return The page ID
     */
    public PageId pageId(int pageNumber) {
        return new PageId(fileName, pageNumber);
    }

    private void checkRange(int pageNumber) throws IOException {
        int pageCount = getPageCount();
        if (pageNumber < 0 || pageNumber >= pageCount) {
            throw new StorageException(ErrorKind.OUT_OF_RANGE, "Page " + pageNumber + " is out of range for " +
                    fileName + " (" + pageCount + " pages)");
        }
    }

    private void writeFully(ByteBuffer buffer, long offset) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer, offset + buffer.position());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Page file " + fileName + " is closed");
        }
    }
}
