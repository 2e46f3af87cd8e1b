package checklist.taskstore.infrastructure.executor.function;

/** Checked Exception 을 던질 수 있는 Supplier */
@FunctionalInterface
public interface ThrowingSupplier<T> {

  T get() throws Throwable;
}
