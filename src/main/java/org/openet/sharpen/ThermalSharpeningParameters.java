package org.openet.sharpen;

import org.openet.sharpen.core.SharpeningException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * The parameters of {@link ThermalSharpeningOp}. Property keys are the parameter names.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class ThermalSharpeningParameters {

    // kernel radius of the local linear regression, in coarse pixels;
    // lower values for more heterogeneous areas
    private int kernelSize = SharpenConstants.DEFAULT_KERNEL_SIZE;
    // coefficient of variation below which a coarse pixel is homogeneous
    private double cvThreshold = SharpenConstants.DEFAULT_CV_THRESHOLD;
    private double samplingRate = SharpenConstants.DEFAULT_SAMPLING_RATE;
    private long randomSeed = 0L;
    private int numberOfTrees = SharpenConstants.DEFAULT_NUMBER_OF_TREES;
    private int variablesPerSplit = SharpenConstants.DEFAULT_VARIABLES_PER_SPLIT;
    private int minLeafPopulation = SharpenConstants.DEFAULT_MIN_LEAF_POPULATION;
    private double bagFraction = SharpenConstants.DEFAULT_BAG_FRACTION;
    private int maxTreeDepth = SharpenConstants.DEFAULT_MAX_TREE_DEPTH;
    private int minTrainingSamples = SharpenConstants.DEFAULT_MIN_TRAINING_SAMPLES;
    private boolean applyEnergyConservation = true;
    private boolean exportDebugBands = false;
    // overrides of the sensor profile, in metres; NaN uses the profile value
    private double tirResolution = Double.NaN;
    private double ecWindow = Double.NaN;

    public static ThermalSharpeningParameters fromProperties(Properties properties) throws SharpeningException {
        ThermalSharpeningParameters parameters = new ThermalSharpeningParameters();
        try {
            String value;
            if ((value = properties.getProperty("kernelSize")) != null) {
                parameters.setKernelSize(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty("cvThreshold")) != null) {
                parameters.setCvThreshold(Double.parseDouble(value.trim()));
            }
            if ((value = properties.getProperty("samplingRate")) != null) {
                parameters.setSamplingRate(Double.parseDouble(value.trim()));
            }
            if ((value = properties.getProperty("randomSeed")) != null) {
                parameters.setRandomSeed(Long.parseLong(value.trim()));
            }
            if ((value = properties.getProperty("numberOfTrees")) != null) {
                parameters.setNumberOfTrees(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty("variablesPerSplit")) != null) {
                parameters.setVariablesPerSplit(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty("minLeafPopulation")) != null) {
                parameters.setMinLeafPopulation(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty("bagFraction")) != null) {
                parameters.setBagFraction(Double.parseDouble(value.trim()));
            }
            if ((value = properties.getProperty("maxTreeDepth")) != null) {
                parameters.setMaxTreeDepth(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty("minTrainingSamples")) != null) {
                parameters.setMinTrainingSamples(Integer.parseInt(value.trim()));
            }
            if ((value = properties.getProperty("applyEnergyConservation")) != null) {
                parameters.setApplyEnergyConservation(parseBoolean("applyEnergyConservation", value));
            }
            if ((value = properties.getProperty("exportDebugBands")) != null) {
                parameters.setExportDebugBands(parseBoolean("exportDebugBands", value));
            }
            if ((value = properties.getProperty("tirResolution")) != null) {
                parameters.setTirResolution(Double.parseDouble(value.trim()));
            }
            if ((value = properties.getProperty("ecWindow")) != null) {
                parameters.setEcWindow(Double.parseDouble(value.trim()));
            }
        } catch (NumberFormatException e) {
            throw new SharpeningException("Invalid parameter value: " + e.getMessage(), e);
        }
        return parameters;
    }

    public static ThermalSharpeningParameters load(InputStream inputStream) throws SharpeningException {
        Properties properties = new Properties();
        try {
            properties.load(inputStream);
        } catch (IOException e) {
            throw new SharpeningException("Failed to read sharpening parameters: " + e.getMessage(), e);
        }
        return fromProperties(properties);
    }

    private static boolean parseBoolean(String name, String value) throws SharpeningException {
        final String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new SharpeningException("Invalid value for " + name + ": " + value);
    }

    private static void checkInterval(String name, double value, double min, double max, boolean minInclusive)
            throws SharpeningException {
        final boolean aboveMin = minInclusive ? value >= min : value > min;
        if (!aboveMin || !(value <= max)) {
            throw new SharpeningException(String.format("Parameter %s = %s is out of interval %s%s, %s]",
                                                        name, value, minInclusive ? "[" : "(", min, max));
        }
    }

    public int getKernelSize() {
        return kernelSize;
    }

    public void setKernelSize(int kernelSize) {
        checkInterval("kernelSize", kernelSize, 1, 100, true);
        this.kernelSize = kernelSize;
    }

    public double getCvThreshold() {
        return cvThreshold;
    }

    public void setCvThreshold(double cvThreshold) {
        checkInterval("cvThreshold", cvThreshold, 0.0, 1.0, false);
        this.cvThreshold = cvThreshold;
    }

    public double getSamplingRate() {
        return samplingRate;
    }

    public void setSamplingRate(double samplingRate) {
        checkInterval("samplingRate", samplingRate, 0.0, 1.0, false);
        this.samplingRate = samplingRate;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public void setNumberOfTrees(int numberOfTrees) {
        checkInterval("numberOfTrees", numberOfTrees, 1, 1000, true);
        this.numberOfTrees = numberOfTrees;
    }

    public int getVariablesPerSplit() {
        return variablesPerSplit;
    }

    public void setVariablesPerSplit(int variablesPerSplit) {
        checkInterval("variablesPerSplit", variablesPerSplit, 1, 100, true);
        this.variablesPerSplit = variablesPerSplit;
    }

    public int getMinLeafPopulation() {
        return minLeafPopulation;
    }

    public void setMinLeafPopulation(int minLeafPopulation) {
        checkInterval("minLeafPopulation", minLeafPopulation, 1, 10000, true);
        this.minLeafPopulation = minLeafPopulation;
    }

    public double getBagFraction() {
        return bagFraction;
    }

    public void setBagFraction(double bagFraction) {
        checkInterval("bagFraction", bagFraction, 0.0, 1.0, false);
        this.bagFraction = bagFraction;
    }

    public int getMaxTreeDepth() {
        return maxTreeDepth;
    }

    public void setMaxTreeDepth(int maxTreeDepth) {
        checkInterval("maxTreeDepth", maxTreeDepth, 2, 100, true);
        this.maxTreeDepth = maxTreeDepth;
    }

    public int getMinTrainingSamples() {
        return minTrainingSamples;
    }

    public void setMinTrainingSamples(int minTrainingSamples) {
        checkInterval("minTrainingSamples", minTrainingSamples, 1, Integer.MAX_VALUE, true);
        this.minTrainingSamples = minTrainingSamples;
    }

    public boolean isApplyEnergyConservation() {
        return applyEnergyConservation;
    }

    public void setApplyEnergyConservation(boolean applyEnergyConservation) {
        this.applyEnergyConservation = applyEnergyConservation;
    }

    public boolean isExportDebugBands() {
        return exportDebugBands;
    }

    public void setExportDebugBands(boolean exportDebugBands) {
        this.exportDebugBands = exportDebugBands;
    }

    public double getTirResolution() {
        return tirResolution;
    }

    public void setTirResolution(double tirResolution) {
        checkInterval("tirResolution", tirResolution, 0.0, Double.MAX_VALUE, false);
        this.tirResolution = tirResolution;
    }

    public double getEcWindow() {
        return ecWindow;
    }

    public void setEcWindow(double ecWindow) {
        checkInterval("ecWindow", ecWindow, 0.0, Double.MAX_VALUE, false);
        this.ecWindow = ecWindow;
    }
}
