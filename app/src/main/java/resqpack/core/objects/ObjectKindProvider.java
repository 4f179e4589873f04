package resqpack.core.objects;

import java.util.List;

/**
 * Service interface through which object kinds are contributed. Implementations
 * are listed in {@code META-INF/services/resqpack.core.objects.ObjectKindProvider}.
 */
public interface ObjectKindProvider {
    List<ObjectKind<?>> kinds();
}
