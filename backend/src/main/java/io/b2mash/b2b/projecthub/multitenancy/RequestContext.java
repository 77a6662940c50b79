package io.b2mash.b2b.projecthub.multitenancy;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Per-request view of who is calling and which organization they act within. Identity and tenant
 * are resolved lazily, at most once each; a resolution failure is remembered and rethrown on every
 * later access.
 *
 * <p>One instance is created per GraphQL request and passed explicitly to every data fetcher. It is
 * never shared between requests.
 */
public final class RequestContext {

  /** Key under which the context is stored in the GraphQL context. */
  public static final String CONTEXT_KEY = "projecthub.requestContext";

  private final Supplier<Principal> identitySource;
  private final Function<Principal, Optional<Tenant>> tenantSource;

  private Memo<Principal> principal;
  private Memo<Optional<Tenant>> tenant;

  public RequestContext(
      Supplier<Principal> identitySource, Function<Principal, Optional<Tenant>> tenantSource) {
    this.identitySource = identitySource;
    this.tenantSource = tenantSource;
  }

  /** A context whose identity and tenant are already known. */
  public static RequestContext resolved(Principal principal, Tenant tenant) {
    return new RequestContext(() -> principal, p -> Optional.ofNullable(tenant));
  }

  public static RequestContext anonymous() {
    return resolved(Principal.ANONYMOUS, null);
  }

  public synchronized Principal principal() {
    if (principal == null) {
      principal = Memo.compute(identitySource);
    }
    return principal.get();
  }

  /** The resolved tenant, resolving identity first if needed. */
  public synchronized Optional<Tenant> tenant() {
    if (tenant == null) {
      Principal current = principal();
      tenant = Memo.compute(() -> tenantSource.apply(current));
    }
    return tenant.get();
  }

  private static final class Memo<T> {

    private final T value;
    private final RuntimeException failure;

    private Memo(T value, RuntimeException failure) {
      this.value = value;
      this.failure = failure;
    }

    static <T> Memo<T> compute(Supplier<T> source) {
      try {
        return new Memo<>(source.get(), null);
      } catch (RuntimeException e) {
        return new Memo<>(null, e);
      }
    }

    T get() {
      if (failure != null) {
        throw failure;
      }
      return value;
    }
  }
}
