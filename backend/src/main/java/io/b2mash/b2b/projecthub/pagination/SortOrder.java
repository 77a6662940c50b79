package io.b2mash.b2b.projecthub.pagination;

import org.springframework.data.domain.Sort;

public enum SortOrder {
  ASC,
  DESC;

  public Sort.Direction direction() {
    return this == ASC ? Sort.Direction.ASC : Sort.Direction.DESC;
  }
}
