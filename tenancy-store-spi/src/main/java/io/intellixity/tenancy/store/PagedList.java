package io.intellixity.tenancy.store;

import java.util.List;
import java.util.function.Function;

/** One page of results plus the opaque token of the next page ({@code null} when there is none). */
public record PagedList<T>(List<T> items, String nextPageToken) {
  public PagedList {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static <T> PagedList<T> empty() {
    return new PagedList<>(List.of(), null);
  }

  public <R> PagedList<R> map(Function<? super T, ? extends R> fn) {
    return new PagedList<>(items.stream().<R>map(fn).toList(), nextPageToken);
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
