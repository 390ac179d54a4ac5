package org.broadinstitute.fastproject.tools.signatures.projection;

import org.broadinstitute.fastproject.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Two-dimensional coordinates for each sample, produced by one projection method.
 */
public final class Projection {

    private final String name;
    private final List<String> samples;
    private final double[][] coordinates;

    private Projection(final String name, final List<String> samples, final double[][] coordinates) {
        this.name = name;
        this.samples = samples;
        this.coordinates = coordinates;
    }

    /**
     * Creates a projection after centering the coordinates and scaling them so that the farthest sample
     * lies at distance 1 from the origin.
     *
     * @param coordinates one {x, y} pair per sample
     */
    public static Projection normalized(final String name, final List<String> samples, final double[][] coordinates) {
        Utils.nonEmpty(name, "projection name");
        Utils.nonNull(samples);
        Utils.nonNull(coordinates);
        Utils.validateArg(coordinates.length == samples.size(), "the number of coordinates does not match the number of samples");
        final double[][] result = new double[coordinates.length][2];
        double meanX = 0;
        double meanY = 0;
        for (final double[] point : coordinates) {
            Utils.validateArg(point.length == 2, "projection coordinates must be two-dimensional");
            meanX += point[0];
            meanY += point[1];
        }
        meanX /= Math.max(coordinates.length, 1);
        meanY /= Math.max(coordinates.length, 1);
        double maxRadius = 0;
        for (int i = 0; i < coordinates.length; i++) {
            result[i][0] = coordinates[i][0] - meanX;
            result[i][1] = coordinates[i][1] - meanY;
            maxRadius = Math.max(maxRadius, Math.hypot(result[i][0], result[i][1]));
        }
        if (maxRadius > 0) {
            for (final double[] point : result) {
                point[0] /= maxRadius;
                point[1] /= maxRadius;
            }
        }
        return new Projection(name, Collections.unmodifiableList(new ArrayList<>(samples)), result);
    }

    /**
     * Creates a projection with coordinates taken as they are.
     */
    public static Projection of(final String name, final List<String> samples, final double[][] coordinates) {
        Utils.nonEmpty(name, "projection name");
        Utils.nonNull(samples);
        Utils.nonNull(coordinates);
        Utils.validateArg(coordinates.length == samples.size(), "the number of coordinates does not match the number of samples");
        final double[][] copy = new double[coordinates.length][];
        for (int i = 0; i < copy.length; i++) {
            Utils.validateArg(coordinates[i].length == 2, "projection coordinates must be two-dimensional");
            copy[i] = coordinates[i].clone();
        }
        return new Projection(name, Collections.unmodifiableList(new ArrayList<>(samples)), copy);
    }

    public String getName() {
        return name;
    }

    public List<String> getSamples() {
        return samples;
    }

    public int numSamples() {
        return samples.size();
    }

    public double getX(final int sampleIndex) {
        return coordinates[sampleIndex][0];
    }

    public double getY(final int sampleIndex) {
        return coordinates[sampleIndex][1];
    }

    /**
     * @return a copy of the N x 2 coordinate array.
     */
    public double[][] getCoordinates() {
        return Arrays.stream(coordinates).map(double[]::clone).toArray(double[][]::new);
    }

    /**
     * Restricts and reorders the projection to the given samples.
     */
    public Projection subsetSamples(final List<String> samplesInOrder) {
        Utils.nonNull(samplesInOrder);
        final double[][] result = new double[samplesInOrder.size()][];
        for (int j = 0; j < result.length; j++) {
            final String sample = samplesInOrder.get(j);
            final int index = samples.indexOf(sample);
            Utils.validateArg(index >= 0, () -> String.format("projection %s has no coordinates for sample %s", name, sample));
            result[j] = coordinates[index].clone();
        }
        return new Projection(name, Collections.unmodifiableList(new ArrayList<>(samplesInOrder)), result);
    }

    /**
     * Appends coordinates for additional samples, as they are.
     */
    public Projection appendSamples(final List<String> additionalSamples, final double[][] additionalCoordinates) {
        Utils.nonNull(additionalSamples);
        Utils.nonNull(additionalCoordinates);
        Utils.validateArg(additionalSamples.size() == additionalCoordinates.length, "the number of coordinates does not match the number of samples");
        final List<String> resultSamples = new ArrayList<>(samples);
        resultSamples.addAll(additionalSamples);
        final double[][] result = new double[resultSamples.size()][];
        for (int i = 0; i < coordinates.length; i++) {
            result[i] = coordinates[i].clone();
        }
        for (int i = 0; i < additionalCoordinates.length; i++) {
            Utils.validateArg(additionalCoordinates[i].length == 2, "projection coordinates must be two-dimensional");
            result[coordinates.length + i] = additionalCoordinates[i].clone();
        }
        return new Projection(name, Collections.unmodifiableList(resultSamples), result);
    }
}
