package org.openet.sharpen;

/**
 * Band names and defaults shared by the sharpening operators.
 */
public class SharpenConstants {

    // predictor (reflectance) bands, in regression order
    public static final String[] PREDICTOR_BAND_NAMES = {"blue", "green", "red", "nir", "swir1", "swir2"};

    // thermal band of the source scene, in Kelvin
    public static final String THERMAL_BAND_NAME = "lst";

    // constant 1, carries the regression intercept
    public static final String BIAS_BAND_NAME = "bias";

    public static final String STD_BAND_SUFFIX = "_std";
    public static final String MEAN_CV_BAND_NAME = "mean_cv";

    public static final String SHARPENED_BAND_NAME = "lst_sharpened";
    public static final String LOCAL_ESTIMATE_BAND_NAME = "lst_sp_local";
    public static final String GLOBAL_ESTIMATE_BAND_NAME = "lst_sp_global";
    public static final String LOCAL_AGG_BAND_NAME = "lst_local_agg";
    public static final String GLOBAL_AGG_BAND_NAME = "lst_global_agg";
    public static final String LOCAL_RESIDUAL_BAND_NAME = "local_residual";
    public static final String GLOBAL_RESIDUAL_BAND_NAME = "global_residual";
    public static final String LOCAL_WEIGHTS_BAND_NAME = "local_weights";
    // 4th root of the root mean square residual of the local regression window
    public static final String SLR_RMSE_BAND_NAME = "slr_rmse";
    public static final String ENERGY_CONSERVATION_RESIDUAL_BAND_NAME = "ec_residual";

    // debug bands
    public static final String SHARPENED_NON_EC_BAND_NAME = "lst_sharpened_non_ec";
    public static final String ORIGINAL_BAND_NAME = "lst_original";
    public static final String AGGREGATED_BAND_NAME = "lst_agg";

    public static final int DEFAULT_KERNEL_SIZE = 20;
    public static final double DEFAULT_CV_THRESHOLD = 0.15;
    public static final double DEFAULT_SAMPLING_RATE = 0.005;
    public static final int DEFAULT_NUMBER_OF_TREES = 100;
    public static final int DEFAULT_VARIABLES_PER_SPLIT = 4;
    public static final int DEFAULT_MIN_LEAF_POPULATION = 50;
    public static final double DEFAULT_BAG_FRACTION = 0.5;
    public static final int DEFAULT_MAX_TREE_DEPTH = 20;
    public static final int DEFAULT_MIN_TRAINING_SAMPLES = 10;

    public static String getStdBandName(String predictorBandName) {
        return predictorBandName + STD_BAND_SUFFIX;
    }

    public static String[] getCoefficientBandNames() {
        String[] names = new String[PREDICTOR_BAND_NAMES.length + 1];
        System.arraycopy(PREDICTOR_BAND_NAMES, 0, names, 0, PREDICTOR_BAND_NAMES.length);
        names[PREDICTOR_BAND_NAMES.length] = BIAS_BAND_NAME;
        return names;
    }
}
