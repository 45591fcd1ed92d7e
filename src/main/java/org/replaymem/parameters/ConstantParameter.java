package org.replaymem.parameters;

import org.replaymem.spi.IParameter;

/**
 * A parameter that never changes.
 */
public final class ConstantParameter implements IParameter {

    private final double value;

    public ConstantParameter(double value) {
        this.value = value;
    }

    @Override
    public double get() {
        return value;
    }

    @Override
    public double next() {
        return value;
    }

    @Override
    public byte[] saveState() {
        return new byte[0];
    }

    @Override
    public void loadState(byte[] state) {
        if (state == null) {
            throw new IllegalArgumentException("ConstantParameter state cannot be null");
        }
    }

    @Override
    public String toString() {
        return "ConstantParameter{" + value + '}';
    }
}
