package gov.nih.ncats.dugr;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {

    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder();

    private static final String PIXEL_ANGLE = "6E-4";

    private File writeImage(File dir, String name, double luminance) throws IOException{
        StringBuilder sb = new StringBuilder("luminance\ncd/m2\n");
        for(int y=0;y<30;y++){
            for(int x=0;x<30;x++){
                if(x>0){
                    sb.append('\t');
                }
                sb.append(x>=10 && x<20 && y>=10 && y<20 ? luminance : 0);
            }
            sb.append('\n');
        }
        File f = new File(dir, name);
        Files.write(f.toPath(), sb.toString().getBytes(StandardCharsets.UTF_8));
        return f;
    }

    private static String read(File f) throws IOException{
        return new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8);
    }

    @Test
    public void singleFileReport() throws Exception{
        File image = writeImage(tmpDir.getRoot(), "luminaire.txt", 3000);
        File out = new File(tmpDir.getRoot(), "reports/luminaire.report");

        Main.main(new String[]{"-f", image.getAbsolutePath(), "-o", out.getAbsolutePath(),
                "-pixelAngle", PIXEL_ANGLE, "-distance", "3", "-lb", "20"});

        String report = read(out);
        assertTrue(report, report.startsWith("File Name: luminaire.txt"));
        assertTrue(report, report.contains("DUGR: "));
        assertTrue(report, report.contains("status: SINGLE_AREA"));
    }

    @Test
    public void reportUsesLuminaireData() throws Exception{
        File image = writeImage(tmpDir.getRoot(), "luminaire.txt", 3000);
        File out = tmpDir.newFile("luminaire.report");

        Main.main(new String[]{"-f", image.getAbsolutePath(), "-o", out.getAbsolutePath(),
                "-pixelAngle", PIXEL_ANGLE, "-distance", "3", "-lb", "20",
                "-guthAlpha", "0", "-guthBeta", "20", "-intensity", "100", "-area", "0.01"});

        String report = read(out);
        assertTrue(report, report.contains("k^2: "));
        assertFalse(report, report.contains("position index: 1.0000"));
    }

    @Test
    public void directoryOfImages() throws Exception{
        File dir = tmpDir.newFolder("images");
        writeImage(dir, "a.txt", 3000);
        writeImage(dir, "b.txt", 4000);
        Files.write(new File(dir, "notes.md").toPath(), "not an image".getBytes(StandardCharsets.UTF_8));
        File outDir = new File(tmpDir.getRoot(), "out");

        Main.main(new String[]{"-dir", dir.getAbsolutePath(), "-outDir", outDir.getAbsolutePath(),
                "-parallel", "2", "-pixelAngle", PIXEL_ANGLE, "-distance", "3", "-lb", "20"});

        assertTrue(read(new File(outDir, "a.txt.dugr.txt")).contains("DUGR: "));
        assertTrue(read(new File(outDir, "b.txt.dugr.txt")).contains("DUGR: "));
        assertFalse(new File(outDir, "notes.md.dugr.txt").exists());
    }

    @Test
    public void badImageDoesNotStopTheDirectory() throws Exception{
        File dir = tmpDir.newFolder("images");
        writeImage(dir, "good.txt", 3000);
        writeImage(dir, "dark.txt", 0);

        Main.main(new String[]{"-dir", dir.getAbsolutePath(),
                "-pixelAngle", PIXEL_ANGLE, "-distance", "3", "-lb", "20"});

        assertTrue(new File(dir, "good.txt.dugr.txt").exists());
        assertFalse(new File(dir, "dark.txt.dugr.txt").exists());
    }

    @Test
    public void reportsAreNotImages(){
        assertTrue(Main.isImageFile(new File("image.PF")));
        assertTrue(Main.isImageFile(new File("image.txt")));
        assertFalse(Main.isImageFile(new File("image.txt.dugr.txt")));
        assertFalse(Main.isImageFile(new File("image.jpg")));
    }

    @Test
    public void settingsUseMeasurementDistance() throws Exception{
        File image = writeImage(tmpDir.getRoot(), "luminaire.txt", 3000);
        GlareContext context = GlareContext.of(6, 20);
        Main.Settings near = new Main.Settings(6E-4, Double.NaN, context, DugrOptions.defaults());
        Main.Settings far = new Main.Settings(6E-4, 3, context, DugrOptions.defaults());
        assertTrue(far.evaluate(image).getGlareIndex() < near.evaluate(image).getGlareIndex());
    }
}
