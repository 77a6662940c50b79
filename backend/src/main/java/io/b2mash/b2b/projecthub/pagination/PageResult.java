package io.b2mash.b2b.projecthub.pagination;

import java.util.List;
import org.springframework.data.domain.Page;

/**
 * One page of results. {@code endCursor} is the offset to pass as {@code after} for the next page.
 */
public record PageResult<T>(List<T> items, PageInfo pageInfo, long totalCount) {

  public static <T> PageResult<T> from(Page<T> page) {
    long offset = page.getPageable().isPaged() ? page.getPageable().getOffset() : 0;
    long total = page.getTotalElements();
    var info =
        new PageInfo(
            offset + page.getNumberOfElements() < total,
            offset > 0,
            String.valueOf(offset),
            String.valueOf(offset + page.getNumberOfElements()));
    return new PageResult<>(page.getContent(), info, total);
  }
}
