package gov.nih.ncats.dugr.algo;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import gov.nih.ncats.dugr.GlareContext;
import gov.nih.ncats.dugr.InvalidInputException;
import gov.nih.ncats.dugr.NumericalDegeneracyException;
import gov.nih.ncats.dugr.segmentation.PartialArea;

/**
 * Glare rating of a luminaire made of several partial areas.
 * <pre>
 *   DUGR = 8 log10( 0.25 / Lb * sum(Li^2 wi) / p^2 )
 * </pre>
 * With one partial area this is the classical UGR formula of a single source.
 */
public class GlareIndexCalculator {
    private static final Logger logger =
        Logger.getLogger (GlareIndexCalculator.class.getName ());

    /**
     * Classical UGR contribution of one uniform source.
     * @param luminance source luminance in cd/m&sup2;.
     * @param solidAngle solid angle of the source in sr.
     * @param backgroundLuminance background luminance in cd/m&sup2;.
     * @param positionIndex Guth position index.
     */
    public static double classicalGlareRating(double luminance, double solidAngle,
                                              double backgroundLuminance, double positionIndex){
        double p2 = positionIndex*positionIndex;
        return 8*Math.log10(0.25/backgroundLuminance * luminance*luminance*solidAngle/p2);
    }

    /**
     * @param areas the partial areas, at least one.
     * @param context background luminance and position index.
     * @throws InvalidInputException if there are no areas or the context values are not positive.
     * @throws NumericalDegeneracyException if the areas subtend no solid angle or carry no luminance.
     */
    public double calculate(List<PartialArea> areas, GlareContext context)
            throws InvalidInputException, NumericalDegeneracyException{
        checkContext(context);
        if(areas.isEmpty()){
            throw new InvalidInputException("no partial areas");
        }
        double totalSolidAngle = areas.stream().mapToDouble(PartialArea::getSolidAngle).sum();
        if(!(totalSolidAngle > 0)){
            throw new NumericalDegeneracyException("partial areas subtend a solid angle of " + totalSolidAngle);
        }
        double weighted = weightedSum(areas);
        if(!(weighted > 0)){
            throw new NumericalDegeneracyException("weighted luminance sum is " + weighted);
        }
        double lb = context.getBackgroundLuminance();
        double p = context.getPositionIndex();
        double rating;
        if(areas.size() == 1){
            PartialArea a = areas.get(0);
            rating = classicalGlareRating(a.getMeanLuminance(), a.getSolidAngle(), lb, p);
        }else{
            rating = 8*Math.log10(0.25/lb * weighted/(p*p));
        }
        logger.fine(areas.size() + " areas, sum L^2 w=" + weighted + " -> " + rating);
        return rating;
    }

    /**
     * Sum of squared mean luminance times solid angle over the areas,
     * added in list order.
     */
    public double weightedSum(List<PartialArea> areas){
        double sum = 0;
        for(PartialArea a : areas){
            double l = a.getMeanLuminance();
            sum += l*l*a.getSolidAngle();
        }
        return sum;
    }

    /**
     * Classical UGR of the luminaire seen as one uniform source of
     * luminance I/A and solid angle A/d&sup2;.
     * @return empty if the context has no luminaire data.
     */
    public Optional<Double> luminaireGlareRating(GlareContext context) throws InvalidInputException{
        if(!context.hasLuminaireData()){
            return Optional.empty();
        }
        checkContext(context);
        double intensity = context.getLuminousIntensity().get();
        double area = context.getLuminousArea().get();
        checkLuminaire(intensity, area);
        double d = context.getViewingDistance();
        return Optional.of(classicalGlareRating(intensity/area, area/(d*d),
                context.getBackgroundLuminance(), context.getPositionIndex()));
    }

    /**
     * The ratio k&sup2; of the partial area sum to the term of the luminaire as
     * a uniform source, so that {@code DUGR = UGR + 8 log10(k^2)}.
     * @return empty if the context has no luminaire data.
     */
    public Optional<Double> correctionFactor(List<PartialArea> areas, GlareContext context)
            throws InvalidInputException{
        if(!context.hasLuminaireData()){
            return Optional.empty();
        }
        checkContext(context);
        double intensity = context.getLuminousIntensity().get();
        double area = context.getLuminousArea().get();
        checkLuminaire(intensity, area);
        double d = context.getViewingDistance();
        double ll = intensity/area;
        double wl = area/(d*d);
        return Optional.of(weightedSum(areas)/(ll*ll*wl));
    }

    private static void checkLuminaire(double intensity, double area) throws InvalidInputException{
        if(!(intensity > 0) || Double.isInfinite(intensity)){
            throw new InvalidInputException("luminous intensity must be positive: " + intensity);
        }
        if(!(area > 0) || Double.isInfinite(area)){
            throw new InvalidInputException("luminous area must be positive: " + area);
        }
    }

    static void checkContext(GlareContext context) throws InvalidInputException{
        double lb = context.getBackgroundLuminance();
        if(!(lb > 0) || Double.isInfinite(lb)){
            throw new InvalidInputException("background luminance must be positive: " + lb);
        }
        double p = context.getPositionIndex();
        if(!(p > 0) || Double.isInfinite(p)){
            throw new InvalidInputException("position index must be positive: " + p);
        }
        double d = context.getViewingDistance();
        if(!(d > 0) || Double.isInfinite(d)){
            throw new InvalidInputException("viewing distance must be positive: " + d);
        }
    }
}
