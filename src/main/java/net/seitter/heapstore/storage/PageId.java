package net.seitter.heapstore.storage;

import java.util.Objects;

/**
 * Uniquely identifies a page within the storage engine.
 * A PageId consists of the name of the page file and the page number within that file,
 * where the page number equals the byte offset divided by the page size.
 */
public class PageId {
    private final String fileName;
    private final int pageNumber;

    /**
     * Creates a new PageId.
     *
     * @param fileName The name of the page file containing the page
     * @param pageNumber The number of the page within the file
     */
    public PageId(String fileName, int pageNumber) {
        this.fileName = fileName;
        this.pageNumber = pageNumber;
    }

    /**
     * Gets the page file name.
     *
     * @return The file name
     */
    public String getFileName() {
        return fileName;
    }

    /**
     * Gets the page number.
     *
     * @return The page number
     */
    public int getPageNumber() {
        return pageNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PageId pageId = (PageId) o;
        return pageNumber == pageId.pageNumber &&
               Objects.equals(fileName, pageId.fileName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, pageNumber);
    }

    @Override
    public String toString() {
        return fileName + ":" + pageNumber;
    }
}
