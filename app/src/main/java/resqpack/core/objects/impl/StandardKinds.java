package resqpack.core.objects.impl;

import java.util.List;

import resqpack.core.objects.ObjectKind;
import resqpack.core.objects.ObjectKindProvider;

/**
 * Object kinds shipped with the library.
 */
public final class StandardKinds implements ObjectKindProvider {

    @Override
    public List<ObjectKind<?>> kinds() {
        return List.of(
                LocalDepth3dCrs.KIND,
                IjkGridRepresentation.KIND,
                PropertyKind.KIND,
                StringTableLookup.KIND,
                ContinuousProperty.KIND,
                DiscreteProperty.KIND,
                MdDatum.KIND,
                WellboreFeature.KIND,
                WellboreInterpretation.KIND,
                WellboreTrajectoryRepresentation.KIND);
    }
}
