package gov.nih.ncats.dugr.image;

import com.twelvemonkeys.imageio.stream.ByteArrayImageInputStream;

import java.awt.image.Raster;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

/**
 * Reads luminance images.
 * <ul>
 *     <li>TechnoTeam images: {@code *.pus} (camera image, unsigned 16 bit),
 *     {@code *.pf} (luminance image, 32 bit float) and {@code *.pcf}
 *     (color image, three 32 bit floats per pixel; the Y channel is the luminance)</li>
 *     <li>ASCII images {@code *.txt}: two header lines, then one tab separated row per line</li>
 *     <li>anything ImageIO can read, {@code *.tif}, {@code *.tiff} and {@code *.png};
 *     the first band is taken as the luminance</li>
 * </ul>
 */
public final class LuminanceImageIO {
    private static final Logger logger =
        Logger.getLogger (LuminanceImageIO.class.getName ());

    static final String TYPE_KEY = "Typ";
    static final String LINES_KEY = "Lines";
    static final String COLUMNS_KEY = "Columns";

    static final String CAMERA_TYPE = "Pic98::TPlane<unsigned short>";
    static final String LUMINANCE_TYPE = "Pic98::TPlane<float>";
    static final String COLOR_TYPE = "Pic98::TPlane<Pic98::TRGBFloatPixel>";

    private LuminanceImageIO(){
        //can not instantiate
    }

    public static LuminanceImage read(File file) throws IOException{
        return read(Files.readAllBytes(file.toPath()), file.getName());
    }

    /**
     * @param data the encoded image.
     * @param fileName name of the file the data came from; its extension selects the format.
     * @throws IOException if the format is not supported or the data is malformed.
     */
    public static LuminanceImage read(byte[] data, String fileName) throws IOException{
        String ext = extension(fileName);
        switch(ext){
            case "pus":
            case "pf":
            case "pcf":
                return readTechnoTeam(data);
            case "txt":
                return readAscii(data);
            case "tif":
            case "tiff":
            case "png":
                return readImage(data, ext);
            default:
                throw new IOException("unsupported image format '" + ext + "' of " + fileName
                        + "; valid formats are pus, pf, pcf, txt, tif, tiff and png");
        }
    }

    /**
     * The lower case extension of the file name, empty if there is none.
     */
    public static String extension(String fileName){
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot+1).toLowerCase(Locale.ROOT);
    }

    static LuminanceImage readTechnoTeam(byte[] data) throws IOException{
        int end = 0;
        while(end < data.length && data[end] != 0){
            end++;
        }
        if(end == data.length){
            throw new IOException("no end of header found");
        }
        Map<String,String> header = parseHeader(new String(data, 0, end, StandardCharsets.UTF_8));

        String type = header.get(TYPE_KEY);
        int lines = intValue(header, LINES_KEY);
        int columns = intValue(header, COLUMNS_KEY);
        if(type == null || lines <= 0 || columns <= 0){
            throw new IOException("header seems to be corrupted: image type or size is not defined");
        }

        int bytesPerPixel;
        int channels;
        switch(type){
            case CAMERA_TYPE:
                bytesPerPixel = 2;
                channels = 1;
                break;
            case LUMINANCE_TYPE:
                bytesPerPixel = 4;
                channels = 1;
                break;
            case COLOR_TYPE:
                bytesPerPixel = 12;
                channels = 3;
                break;
            default:
                throw new IOException("header seems to be corrupted: unknown image type " + type);
        }
        long needed = (long)lines*columns*bytesPerPixel;
        int available = data.length - end - 1;
        if(available < needed){
            throw new IOException("expected " + needed + " bytes of pixel data but found " + available);
        }

        ByteBuffer buf = ByteBuffer.wrap(data, end+1, available).order(ByteOrder.LITTLE_ENDIAN);
        double[] samples = new double[lines*columns];
        for(int i=0;i<samples.length;i++){
            if(bytesPerPixel == 2){
                samples[i] = buf.getShort() & 0xFFFF;
            }else if(channels == 1){
                samples[i] = buf.getFloat();
            }else{
                buf.getFloat();
                samples[i] = buf.getFloat();
                buf.getFloat();
            }
        }
        logger.fine("read " + type + " image " + columns + "x" + lines);
        return new LuminanceImage(columns, lines, samples, header);
    }

    static Map<String,String> parseHeader(String text) throws IOException{
        String cleaned = text.replace("\r", "").replace("|", "");
        Map<String,String> header = new LinkedHashMap<>();
        for(String line : cleaned.split("\n")){
            if(line.isEmpty()){
                continue;
            }
            int eq = line.indexOf('=');
            if(eq < 0){
                throw new IOException("header seems to be corrupted: " + line);
            }
            header.put(line.substring(0, eq), line.substring(eq+1));
        }
        return header;
    }

    private static int intValue(Map<String,String> header, String key) throws IOException{
        String v = header.get(key);
        if(v == null){
            return -1;
        }
        try{
            return Integer.parseInt(v.trim());
        }catch(NumberFormatException e){
            throw new IOException("header seems to be corrupted: " + key + "=" + v, e);
        }
    }

    static LuminanceImage readAscii(byte[] data) throws IOException{
        String[] lines = new String(data, StandardCharsets.UTF_8).split("\n");
        List<double[]> rows = new ArrayList<>();
        for(int i=2;i<lines.length;i++){
            String line = lines[i].replace("\r", "");
            if(line.trim().isEmpty()){
                continue;
            }
            String[] cols = line.replace(',', '.').split("\t");
            double[] row = new double[cols.length];
            for(int j=0;j<cols.length;j++){
                try{
                    row[j] = Double.parseDouble(cols[j].trim());
                }catch(NumberFormatException e){
                    throw new IOException("bad value '" + cols[j] + "' in line " + (i+1), e);
                }
            }
            if(!rows.isEmpty() && row.length != rows.get(0).length){
                throw new IOException("line " + (i+1) + " has " + row.length
                        + " values but the first row has " + rows.get(0).length);
            }
            rows.add(row);
        }
        if(rows.isEmpty()){
            throw new IOException("no pixel rows found");
        }
        int width = rows.get(0).length;
        double[] samples = new double[width*rows.size()];
        for(int y=0;y<rows.size();y++){
            System.arraycopy(rows.get(y), 0, samples, y*width, width);
        }
        return new LuminanceImage(width, rows.size(), samples);
    }

    static LuminanceImage readImage(byte[] data, String format) throws IOException{
        try(ImageInputStream input = new ByteArrayImageInputStream(data)) {
            Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(format);
            if(!readers.hasNext()){
                readers = ImageIO.getImageReaders(input);
            }
            if (!readers.hasNext()) {
                throw new IOException("No reader found for format " + format);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input);
                Raster raster = reader.read(0).getData();
                int w = raster.getWidth();
                int h = raster.getHeight();
                double[] samples = new double[w*h];
                double[] row = new double[w];
                for(int y=0;y<h;y++){
                    raster.getSamples(raster.getMinX(), raster.getMinY()+y, w, 1, 0, row);
                    System.arraycopy(row, 0, samples, y*w, w);
                }
                return new LuminanceImage(w, h, samples);
            } finally {
                reader.dispose();
            }
        }
    }
}
