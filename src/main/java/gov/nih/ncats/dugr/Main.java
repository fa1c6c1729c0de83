package gov.nih.ncats.dugr;

import gov.nih.ncats.common.cli.Cli;
import gov.nih.ncats.common.cli.CliSpecification;
import gov.nih.ncats.common.cli.CliValidationException;
import gov.nih.ncats.common.functions.ThrowableConsumer;
import gov.nih.ncats.dugr.image.binarization.DetectionThreshold;
import gov.nih.ncats.dugr.image.LuminanceImageIO;

import java.io.*;
import java.nio.file.Files;
import java.util.AbstractMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import static gov.nih.ncats.common.cli.CliSpecification.*;

/**
 * Command line interface.
 */
public class Main {
    private static final Logger logger =
        Logger.getLogger (Main.class.getName ());

    private static final String REPORT_SUFFIX = ".dugr.txt";

    private static class DirectoryProcessor{
        private int numThreads =1;

        private File dir, outputDir;

        public int getNumThreads() {
            return numThreads;
        }

        public void setNumThreads(int numThreads) throws IOException{
            if(numThreads < 1){
                throw new CliValidationException("num of threads must be >=1");
            }
            this.numThreads = numThreads;
        }

        public File getDir() {
            return dir;
        }

        public void setDir(File dir) throws IOException{
            if(!dir.exists()){
                throw new FileNotFoundException("directory '" + dir.getAbsolutePath() + "' does not exist");
            }
            this.dir = dir;
        }

        public File getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(File outputDir) throws IOException {
            if(outputDir !=null){
                Files.createDirectories(outputDir.toPath());
            }
            this.outputDir = outputDir;
        }
    }

    /**
     * Everything needed to evaluate one image besides the image itself.
     */
    static class Settings{
        final double pixelAngle;
        final double measurementDistance;
        final GlareContext context;
        final DugrOptions options;

        Settings(double pixelAngle, double measurementDistance, GlareContext context, DugrOptions options){
            this.pixelAngle = pixelAngle;
            this.measurementDistance = measurementDistance;
            this.context = context;
            this.options = options;
        }

        GlareResult evaluate(File f) throws IOException, GlareException{
            try {
                return Dugr.evaluate(LuminanceImageIO.read(f).toField(pixelAngle, measurementDistance, null),
                        context, options);
            }catch(IllegalArgumentException e){
                throw new InvalidInputException(f.getName() + ": " + e.getMessage());
            }
        }
    }

    static CliSpecification createSpecification(DirectoryProcessor directoryProcessor){
        return CliSpecification.createWithHelp(
                radio(
                        group(option("f").longName("file")
                                        .argName("path")
                                        .description("path of the luminance image to process. Supported formats are pus, pf, pcf (TechnoTeam), txt (ascii), tif and png. This option or -dir is required")
                                        .setRequired(true),
                                option("o").longName("out")
                                        .argName("path")
                                        .description("path of the report file. If not specified the report is sent to STDOUT")
                        ),
                        group(
                                option("dir")
                                        .argName("path")
                                        .description("path to a directory of luminance images to process. " +
                                                "Each image file found will be evaluated. If -outDir is not specified then " +
                                                "each report will be put in the same directory and named $filename" + REPORT_SUFFIX +
                                                ". This option or -f is required")
                                        .setToFile(directoryProcessor::setDir)
                                        .setRequired(true),
                                option("outDir")
                                        .argName("path")
                                        .setToFile(directoryProcessor::setOutputDir)
                                        .description("path to output directory to put the reports. If this path does not exist it will be created"),
                                option("parallel")
                                        .argName("count")
                                        .setToInt(directoryProcessor::setNumThreads)
                                        .description("Number of images to process simultaneously, if not specified defaults to 1")
                        )),
                option("pixelAngle")
                        .argName("radians")
                        .setRequired(true)
                        .description("angular size of one pixel seen from the camera position"),
                option("distance")
                        .argName("m")
                        .setRequired(true)
                        .description("viewing distance between observer and luminaire"),
                option("lb")
                        .argName("cd/m2")
                        .setRequired(true)
                        .description("background luminance"),
                option("measurementDistance")
                        .argName("m")
                        .description("distance of the camera to the luminaire, if different from the viewing distance"),
                option("p")
                        .argName("value")
                        .addValidation(cli -> !cli.hasOption("guthAlpha") && !cli.hasOption("guthBeta"),
                                "-p is not valid together with -guthAlpha and -guthBeta")
                        .description("Guth position index, defaults to 1"),
                option("guthAlpha")
                        .argName("degrees")
                        .description("azimuth of the luminaire from the vertical plane of the line of sight, requires -guthBeta"),
                option("guthBeta")
                        .argName("degrees")
                        .description("elevation of the luminaire above the line of sight, requires -guthAlpha"),
                option("threshold")
                        .argName("cd/m2")
                        .addValidation(cli -> !cli.hasOption("relThreshold"), "-threshold is not valid together with -relThreshold")
                        .description("absolute luminance threshold of the luminous area, defaults to "
                                + DetectionThreshold.DEFAULT_ABSOLUTE_THRESHOLD),
                option("relThreshold")
                        .argName("fraction")
                        .description("luminance threshold of the luminous area as fraction of the maximum luminance"),
                option("intensity")
                        .argName("cd")
                        .description("luminous intensity of the luminaire towards the observer, requires -area"),
                option("area")
                        .argName("m2")
                        .description("projected luminous area of the luminaire, requires -intensity")
        )
        .programName("dugr")
        .description("Computes the glare rating (DUGR) of non-uniform luminaires from luminance images following CIE 232:2019.")
        .addValidation(cli -> cli.hasOption("f") || cli.hasOption("dir"), "-f or -dir option is required")
        .addValidation(cli -> cli.hasOption("guthAlpha") == cli.hasOption("guthBeta"),
                "-guthAlpha and -guthBeta must be used together")
        .addValidation(cli -> cli.hasOption("intensity") == cli.hasOption("area"),
                "-intensity and -area must be used together")
        .example("-f /path/to/image.pf -pixelAngle 0.0003 -distance 3 -lb 10",
                "evaluate the given image and print the report to STDOUT")
        .example("-dir /path/to/directory -pixelAngle 0.0003 -distance 3 -lb 10",
                "evaluate all the images inside the given directory and write a report for each image named $image.file" + REPORT_SUFFIX)
        .example("-dir /path/to/directory -outDir /path/to/outputDir -parallel 4 -pixelAngle 0.0003 -distance 3 -lb 10",
                "evaluate in 4 concurrent threads all the images inside the given directory and put the reports in outDir")
        .footer("Developed by NIH/NCATS");
    }

    static Settings createSettings(Cli cli) throws CliValidationException{
        double pixelAngle = doubleValue(cli, "pixelAngle");
        double measurementDistance = cli.hasOption("measurementDistance")
                ? doubleValue(cli, "measurementDistance") : Double.NaN;

        GlareContext context = GlareContext.of(doubleValue(cli, "distance"), doubleValue(cli, "lb"));
        try {
            if (cli.hasOption("p")) {
                context = context.withPositionIndex(doubleValue(cli, "p"));
            } else if (cli.hasOption("guthAlpha")) {
                context = context.withGuthAngles(doubleValue(cli, "guthAlpha"), doubleValue(cli, "guthBeta"));
            }
            if (cli.hasOption("intensity")) {
                context = context.withLuminaire(doubleValue(cli, "intensity"), doubleValue(cli, "area"));
            }

            DugrOptions.Builder options = DugrOptions.builder();
            if (cli.hasOption("threshold")) {
                options.setDetectionThreshold(DetectionThreshold.absolute(doubleValue(cli, "threshold")));
            } else if (cli.hasOption("relThreshold")) {
                options.setDetectionThreshold(DetectionThreshold.relative(doubleValue(cli, "relThreshold")));
            }
            return new Settings(pixelAngle, measurementDistance, context, options.build());
        }catch(IllegalArgumentException e){
            throw new CliValidationException(e.getMessage(), e);
        }
    }

    private static double doubleValue(Cli cli, String option) throws CliValidationException{
        String value = cli.getOptionValue(option);
        try{
            return Double.parseDouble(value);
        }catch(NumberFormatException | NullPointerException e){
            throw new CliValidationException("-" + option + " must be a number but was '" + value + "'", e);
        }
    }

    static boolean isImageFile(File f){
        String name = f.getName();
        if(name.endsWith(REPORT_SUFFIX)){
            return false;
        }
        String ext = LuminanceImageIO.extension(name);
        return Arrays.asList("pus", "pf", "pcf", "txt", "tif", "tiff", "png").contains(ext);
    }

    private static Map<String,String> propertiesFor(File f){
        Map<String,String> props = new LinkedHashMap<>();
        props.put("File Name", f.getName());
        return props;
    }

    public static void main(String[] args) throws Exception{

        DirectoryProcessor directoryProcessor = new DirectoryProcessor();
        CliSpecification spec = createSpecification(directoryProcessor);

        if(spec.helpRequested(args)){
            System.out.println(spec.generateUsage());
            return;
        }
        try {
            Cli cli =spec.parse(args);
            Settings settings = createSettings(cli);

            if(cli.hasOption("f")){
                File f = new File(cli.getOptionValue("f"));
                String report;
                try {
                    report = settings.evaluate(f).getReport(propertiesFor(f));
                }catch(GlareException e){
                    throw new CliValidationException(f.getName() + ": " + e.getMessage(), e);
                }
                if(cli.hasOption("o")){
                    File outputFile = new File(cli.getOptionValue("o"));
                    File parent = outputFile.getParentFile();
                    if(parent !=null){
                        Files.createDirectories(parent.toPath());
                    }

                    try(PrintWriter writer = new PrintWriter(new FileWriter(outputFile))){
                        writer.print(report);
                    }
                }else{
                    System.out.print(report);
                }
            }else if(cli.hasOption("dir")){
                File dir = directoryProcessor.getDir();

                File outputDir = directoryProcessor.getOutputDir();
                if(outputDir ==null){
                    outputDir = dir;
                }
                File files[] = dir.listFiles(Main::isImageFile);
                if(files ==null || files.length ==0){
                    System.out.println("No image files found");
                    return;
                }
                Arrays.sort(files);

                //we have to do this to make the compiler happy to use this inside a lambda
                final File effectivelyFinalOutputDir = outputDir;
                ThrowableConsumer<Map.Entry<File, GlareResult>, IOException> writeReport = e -> {
                    File out = new File(effectivelyFinalOutputDir, e.getKey().getName() + REPORT_SUFFIX);
                    try (PrintWriter writer = new PrintWriter(out)) {
                        writer.print(e.getValue().getReport(propertiesFor(e.getKey())));
                    }
                };

                int numThreads = directoryProcessor.getNumThreads();
                if(numThreads ==1){
                    //run in serial
                    for (File f : files) {
                        try {
                            writeReport.accept(new AbstractMap.SimpleImmutableEntry<>(f, settings.evaluate(f)));
                        } catch (Throwable t) {
                            logger.log(Level.WARNING, "error processing file " + f.getName(), t);
                        }
                    }
                }else {
                    ExecutorService executorService = Executors.newFixedThreadPool(numThreads);
                    CountDownLatch latch = new CountDownLatch(files.length);
                    for (File f : files) {
                        executorService.submit(new DugrRunnable(f, settings, latch, writeReport));
                    }
                    executorService.shutdown();
                    latch.await();
                }
            }else{
                //invalid
                throw new CliValidationException("file or directory not specified");
            }
        }catch(CliValidationException e) {
            System.err.println(e.getMessage());
            System.err.println("\n\n" + spec.generateUsage());
            System.exit(-1);
        }
    }

    private static class DugrRunnable implements Callable<Void>{
        File f;
        Settings settings;
        CountDownLatch latch;
        ThrowableConsumer<Map.Entry<File, GlareResult>, IOException> resultConsumer;

        DugrRunnable(File f, Settings settings, CountDownLatch latch,
                     ThrowableConsumer<Map.Entry<File, GlareResult>, IOException> resultConsumer){
            this.f =f;
            this.settings = settings;
            this.latch = latch;
            this.resultConsumer = resultConsumer;
        }

        @Override
        public Void call() throws Exception{
            try {
                resultConsumer.accept(new AbstractMap.SimpleImmutableEntry<>(f, settings.evaluate(f)));
                return null;
            }catch(Exception e){
                logger.log(Level.WARNING, "error processing file " + f.getName(), e);
                throw e;
            }finally{
                //wait until the end to decrement latch
                latch.countDown();
            }
        }
    }
}
