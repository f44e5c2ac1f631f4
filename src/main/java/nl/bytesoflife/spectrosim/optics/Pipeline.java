package nl.bytesoflife.spectrosim.optics;

import nl.bytesoflife.spectrosim.ShapeMismatchException;
import nl.bytesoflife.spectrosim.axis.SpectralAxis;
import nl.bytesoflife.spectrosim.axis.SpectrumKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Ordered chain of optical elements. Elements are applied in insertion order.
 *
 * <p>The pipeline's own multiplicity either repeats each member {@code n} times in place
 * (default) or, with {@link #withRepeatWholeChain(boolean)}, threads the spectrum through the
 * complete chain {@code n} times end to end. Both give the same transmittance; they differ in
 * where background emission is injected.
 */
public class Pipeline implements OpticalElement {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final String label;
    private final List<OpticalElement> stages = new ArrayList<>();
    private double multiplicity = 1;
    private boolean repeatWholeChain;

    public Pipeline(String label) {
        this.label = label;
    }

    public Pipeline pushBack(OpticalElement stage) {
        stages.add(stage);
        return this;
    }

    public Pipeline pushFront(OpticalElement stage) {
        stages.add(0, stage);
        return this;
    }

    public Pipeline withRepeatWholeChain(boolean enabled) {
        this.repeatWholeChain = enabled;
        return this;
    }

    public boolean isRepeatWholeChain() {
        return repeatWholeChain;
    }

    public List<OpticalElement> getStages() {
        return Collections.unmodifiableList(stages);
    }

    public int size() {
        return stages.size();
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }

    /**
     * Removes every element whose label is listed, descending into nested pipelines.
     *
     * @return number of elements removed
     */
    public int prune(Collection<String> labels) {
        Set<String> targets = Set.copyOf(labels);
        int removed = 0;
        Iterator<OpticalElement> it = stages.iterator();
        while (it.hasNext()) {
            OpticalElement stage = it.next();
            if (targets.contains(stage.getLabel())) {
                it.remove();
                removed++;
                log.debug("Pruned stage '{}' from '{}'", stage.getLabel(), label);
            } else if (stage instanceof Pipeline nested) {
                removed += nested.prune(targets);
            }
        }
        return removed;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public double getMultiplicity() {
        return multiplicity;
    }

    @Override
    public void setMultiplicity(double multiplicity) {
        OpticalElement.roundMultiplicity(multiplicity);
        this.multiplicity = multiplicity;
    }

    @Override
    public double[] getT(SpectralAxis axis) {
        double[] t = new double[axis.size()];
        Arrays.fill(t, 1.0);

        for (OpticalElement stage : stages) {
            double[] st = stage.getT(axis);
            for (int i = 0; i < t.length; i++) {
                t[i] *= st[i];
            }
        }

        int n = getRepeatCount();
        if (n != 1) {
            for (int i = 0; i < t.length; i++) {
                t[i] = Math.pow(t[i], n);
            }
        }
        return t;
    }

    @Override
    public double[] apply(SpectralAxis axis, double[] density, SpectrumKind kind) {
        if (density.length != axis.size()) {
            throw new ShapeMismatchException(axis.size(), density.length);
        }
        int n = getRepeatCount();
        double[] out = density.clone();

        if (repeatWholeChain) {
            for (int pass = 0; pass < n; pass++) {
                for (OpticalElement stage : stages) {
                    out = stage.apply(axis, out, kind);
                }
            }
        } else {
            for (OpticalElement stage : stages) {
                for (int pass = 0; pass < n; pass++) {
                    out = stage.apply(axis, out, kind);
                }
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "Pipeline{" + label + ", stages=" + stages.size() + ", x" + getRepeatCount()
                + (repeatWholeChain ? " (whole chain)" : "") + "}";
    }
}
