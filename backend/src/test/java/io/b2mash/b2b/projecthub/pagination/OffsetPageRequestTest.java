package io.b2mash.b2b.projecthub.pagination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.data.domain.Sort;

class OffsetPageRequestTest {

  @ParameterizedTest
  @CsvSource(
      nullValues = "null",
      value = {"null,0", "'',0", "40,40", "' 7 ',7", "-5,0", "abc,0", "3.5,0"})
  void cursorParsesToOffset(String after, long expected) {
    assertThat(OffsetPageRequest.parseCursor(after)).isEqualTo(expected);
  }

  @ParameterizedTest
  @CsvSource(nullValues = "null", value = {"null,20", "0,1", "-3,1", "50,50", "1000,100"})
  void limitIsClamped(Integer first, int expected) {
    assertThat(OffsetPageRequest.clampLimit(first)).isEqualTo(expected);
  }

  @Test
  void offsetNeedNotAlignWithPageSize() {
    var request = OffsetPageRequest.of(10, "15", Sort.by("name"));

    assertThat(request.getOffset()).isEqualTo(15);
    assertThat(request.getPageSize()).isEqualTo(10);
    assertThat(request.getSort()).isEqualTo(Sort.by("name"));
    assertThat(request.next().getOffset()).isEqualTo(25);
    assertThat(request.previousOrFirst().getOffset()).isEqualTo(5);
  }

  @Test
  void firstPageHasNoPrevious() {
    var request = OffsetPageRequest.of(null, null, null);

    assertThat(request.hasPrevious()).isFalse();
    assertThat(request.previousOrFirst()).isEqualTo(request);
    assertThat(request.getSort().isUnsorted()).isTrue();
  }

  @Test
  void negativeOffsetRejectedByConstructor() {
    assertThatThrownBy(() -> new OffsetPageRequest(-1, 10, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
