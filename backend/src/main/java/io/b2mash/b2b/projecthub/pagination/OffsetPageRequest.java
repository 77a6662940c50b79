package io.b2mash.b2b.projecthub.pagination;

import java.util.Objects;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * A {@link Pageable} addressed by row offset rather than page number. Cursors handed to clients are
 * decimal offsets, so pages need not be aligned to the page size.
 */
public final class OffsetPageRequest implements Pageable {

  public static final int DEFAULT_LIMIT = 20;
  public static final int MAX_LIMIT = 100;

  private final long offset;
  private final int limit;
  private final Sort sort;

  public OffsetPageRequest(long offset, int limit, Sort sort) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    this.offset = offset;
    this.limit = limit;
    this.sort = sort != null ? sort : Sort.unsorted();
  }

  /**
   * Builds a request from client-supplied {@code first}/{@code after}. An unparseable or negative
   * cursor starts from the beginning; {@code first} is clamped to 1..{@value #MAX_LIMIT}.
   */
  public static OffsetPageRequest of(Integer first, String after, Sort sort) {
    return new OffsetPageRequest(parseCursor(after), clampLimit(first), sort);
  }

  static long parseCursor(String after) {
    if (after == null || after.isBlank()) {
      return 0;
    }
    try {
      return Math.max(0, Long.parseLong(after.trim()));
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  static int clampLimit(Integer first) {
    if (first == null) {
      return DEFAULT_LIMIT;
    }
    return Math.min(MAX_LIMIT, Math.max(1, first));
  }

  @Override
  public int getPageNumber() {
    return (int) (offset / limit);
  }

  @Override
  public int getPageSize() {
    return limit;
  }

  @Override
  public long getOffset() {
    return offset;
  }

  @Override
  public Sort getSort() {
    return sort;
  }

  @Override
  public Pageable next() {
    return new OffsetPageRequest(offset + limit, limit, sort);
  }

  @Override
  public Pageable previousOrFirst() {
    return hasPrevious()
        ? new OffsetPageRequest(Math.max(0, offset - limit), limit, sort)
        : first();
  }

  @Override
  public Pageable first() {
    return new OffsetPageRequest(0, limit, sort);
  }

  @Override
  public Pageable withPage(int pageNumber) {
    return new OffsetPageRequest((long) pageNumber * limit, limit, sort);
  }

  @Override
  public boolean hasPrevious() {
    return offset > 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OffsetPageRequest other)) {
      return false;
    }
    return offset == other.offset && limit == other.limit && sort.equals(other.sort);
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, limit, sort);
  }

  @Override
  public String toString() {
    return "OffsetPageRequest[offset=" + offset + ", limit=" + limit + ", sort=" + sort + "]";
  }
}
