package gov.nih.ncats.dugr;

import java.io.File;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

import gov.nih.ncats.dugr.algo.BlurSimulator;
import gov.nih.ncats.dugr.algo.GlareIndexCalculator;
import gov.nih.ncats.dugr.algo.LuminousAreaDetector;
import gov.nih.ncats.dugr.image.LuminanceField;
import gov.nih.ncats.dugr.image.LuminanceImageIO;
import gov.nih.ncats.dugr.image.LuminanceStats;
import gov.nih.ncats.dugr.image.LuminousAreaMask;
import gov.nih.ncats.dugr.segmentation.PartialAreaSegmenter;
import gov.nih.ncats.dugr.segmentation.Segmentation;

/**
 * Glare rating of non-uniform luminaires from luminance images following CIE 232:2019.
 * <p>
 * The image is blurred to the resolution of the eye, the luminous area is
 * separated from the background and decomposed into approximately uniform
 * partial areas, and the DUGR is computed from their luminances and solid angles.
 */
public final class Dugr {
    private static final Logger logger =
        Logger.getLogger (Dugr.class.getName ());

    private Dugr(){
        //can not instantiate
    }

    /**
     * Evaluate the given field using the default options.
     * @see #evaluate(LuminanceField, GlareContext, DugrOptions)
     */
    public static GlareResult evaluate(LuminanceField field, GlareContext context) throws GlareException{
        return evaluate(field, context, null);
    }

    /**
     * Compute the glare rating of the luminaire shown in the given field.
     *
     * @param field the luminance field, can not be null.
     * @param context viewing distance, background luminance and position index, can not be null.
     * @param options the {@link DugrOptions} to use; if options is null, then the default options are used.
     *
     * @return the {@link GlareResult}.
     * @throws InvalidInputException if the field has no valid pixel, is completely dark, or
     * the context has non positive values.
     * @throws NoLuminousAreaException if nothing in the field reaches the detection threshold.
     * @throws NumericalDegeneracyException if the partial areas carry no weight.
     * @throws NullPointerException if field or context is null.
     */
    public static GlareResult evaluate(LuminanceField field, GlareContext context, DugrOptions options)
            throws GlareException{
        Objects.requireNonNull(field, "field can not be null");
        Objects.requireNonNull(context, "context can not be null");
        options = Optional.ofNullable(options).orElse(DugrOptions.defaults());

        LuminanceStats stats = field.stats();
        if(stats.isEmpty()){
            throw new InvalidInputException("field has no valid pixels");
        }
        if(!(stats.max > 0)){
            throw new InvalidInputException("field has no luminance");
        }
        checkContext(context);
        double d = context.getViewingDistance();

        BlurSimulator blurSimulator = new BlurSimulator(options);
        LuminanceField blurred = blurSimulator.blur(field, d);

        LuminousAreaMask mask = new LuminousAreaDetector(options).detect(blurred);
        Segmentation segmentation = new PartialAreaSegmenter(options).segment(blurred, mask, d);

        GlareIndexCalculator calculator = new GlareIndexCalculator();
        double index = calculator.calculate(segmentation.getPartialAreas(), context);

        LuminanceStats whole = segmentation.getTree().getRoot().getStats();
        double omega = whole.count * blurred.solidAnglePerPixel(d);
        GlareDiagnostics diagnostics = GlareDiagnostics.builder()
                .blurSigma(blurSimulator.sigmaInPixels(field, d))
                .threshold(mask.getThreshold())
                .luminousPixelCount(mask.getPixelCount())
                .luminousSolidAngle(omega)
                .effectiveLuminance(whole.mean)
                .maxLuminance(whole.max)
                .componentCount(mask.getComponentCount())
                .nodeCount(segmentation.getTree().size())
                .splitSearches(segmentation.getSearchCount())
                .weightedSum(calculator.weightedSum(segmentation.getPartialAreas()))
                .wholeAreaRating(GlareIndexCalculator.classicalGlareRating(whole.mean, omega,
                        context.getBackgroundLuminance(), context.getPositionIndex()))
                .luminaireRating(calculator.luminaireGlareRating(context))
                .correctionFactor(calculator.correctionFactor(segmentation.getPartialAreas(), context))
                .build();

        GlareResult result = new ResultAssembler().assemble(index, segmentation, diagnostics, context);
        logger.fine("DUGR " + index + " from " + segmentation.getPartialAreas().size()
                + " partial areas, status " + result.getStatus());
        return result;
    }

    /**
     * Read the given image and compute its glare rating.
     *
     * @param image the luminance image, can not be null. See {@link LuminanceImageIO} for the formats.
     * @param pixelAngle angular pitch of one pixel seen from the viewing position in radians.
     * @param context viewing distance, background luminance and position index, can not be null.
     * @param options the {@link DugrOptions} to use; if options is null, then the default options are used.
     *
     * @throws IOException if there are any problems reading the image.
     * @throws GlareException if the glare rating can not be computed.
     */
    public static GlareResult evaluate(File image, double pixelAngle, GlareContext context, DugrOptions options)
            throws IOException, GlareException{
        Objects.requireNonNull(image, "image can not be null");
        LuminanceField field;
        try{
            field = LuminanceImageIO.read(image).toField(pixelAngle);
        }catch(IllegalArgumentException e){
            throw new InvalidInputException(image.getName() + ": " + e.getMessage());
        }
        return evaluate(field, context, options);
    }

    /**
     * Evaluate the field on the given executor. Failures complete the returned
     * future exceptionally with a {@link CompletionException} wrapping the {@link GlareException}.
     */
    public static CompletableFuture<GlareResult> evaluateAsync(LuminanceField field, GlareContext context,
                                                               DugrOptions options, Executor executor){
        return CompletableFuture.supplyAsync(() -> {
            try{
                return evaluate(field, context, options);
            }catch(GlareException e){
                throw new CompletionException(e);
            }
        }, executor);
    }

    private static void checkContext(GlareContext context) throws InvalidInputException{
        double d = context.getViewingDistance();
        if(!(d > 0) || Double.isInfinite(d)){
            throw new InvalidInputException("viewing distance must be positive: " + d);
        }
        double lb = context.getBackgroundLuminance();
        if(!(lb > 0) || Double.isInfinite(lb)){
            throw new InvalidInputException("background luminance must be positive: " + lb);
        }
        double p = context.getPositionIndex();
        if(!(p > 0) || Double.isInfinite(p)){
            throw new InvalidInputException("position index must be positive: " + p);
        }
    }
}
