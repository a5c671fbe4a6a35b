package ca.gc.cra.assay.infrastructure.junit;

import ca.gc.cra.assay.api.Assay;
import ca.gc.cra.assay.api.Asserter;
import ca.gc.cra.assay.application.port.TestHandle;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;

/**
 * JUnit Jupiter extension injecting {@link Asserter} and {@link TestHandle} parameters.
 *
 * <p>Each test gets one {@link JUnitTestHandle}; non-fatal failures recorded on it fail the test after it
 * returns.
 *
 * <pre>{@code
 * @ExtendWith(AssayExtension.class)
 * class OrderTest {
 *   @Test
 *   void totals(Asserter assay) {
 *     assay.equal(order.total(), 42);
 *   }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class AssayExtension implements ParameterResolver, AfterEachCallback {
  private static final ExtensionContext.Namespace NAMESPACE =
      ExtensionContext.Namespace.create(AssayExtension.class);
  private static final String HANDLE_KEY = "handle";

  @Override
  public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
    Class<?> type = parameterContext.getParameter().getType();
    return type == Asserter.class || type == TestHandle.class || type == JUnitTestHandle.class;
  }

  @Override
  public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
    JUnitTestHandle handle = handle(extensionContext);
    Class<?> type = parameterContext.getParameter().getType();
    return type == Asserter.class ? Assay.of(handle) : handle;
  }

  @Override
  public void afterEach(ExtensionContext context) {
    JUnitTestHandle handle = context.getStore(NAMESPACE).get(HANDLE_KEY, JUnitTestHandle.class);
    if (handle != null) {
      handle.verify();
    }
  }

  static JUnitTestHandle handle(ExtensionContext context) {
    return context.getStore(NAMESPACE)
        .getOrComputeIfAbsent(HANDLE_KEY, key -> new JUnitTestHandle(context.getDisplayName()),
            JUnitTestHandle.class);
  }
}
