package mineralmap.raster;

import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ShortProcessor;
import mineralmap.TestRasters;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class EnviReaderWriterTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static double[][][] gradientCube(int width, int height, int bands) {
        double[][][] spectra = new double[height][width][bands];
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                for (int b = 0; b < bands; b++)
                    spectra[y][x][b] = b * 100 + y * width + x - 50;
        return spectra;
    }

    private static void assertCube(double[][][] expected, RasterCube cube) {
        Assert.assertEquals(expected.length, cube.getHeight());
        Assert.assertEquals(expected[0].length, cube.getWidth());
        Assert.assertEquals(expected[0][0].length, cube.getNumBands());

        for (int y = 0; y < cube.getHeight(); y++)
            for (int x = 0; x < cube.getWidth(); x++)
                Assert.assertArrayEquals("pixel " + x + "," + y, expected[y][x], cube.getSpectrum(x, y), 0);
    }

    @Test
    public void testInterleavesReadIdentically() throws Exception {
        double[][][] spectra = gradientCube(5, 4, 3);
        Path root = folder.getRoot().toPath();

        for (Interleave interleave : Interleave.values()) {
            Path header = root.resolve("cube_" + interleave.getHeaderValue() + ".hdr");
            TestRasters.writeCube(header, spectra, null, interleave, EnviDataType.FLOAT32, true);

            StackRasterCube cube = EnviReader.readCube(header);
            assertCube(spectra, cube);
            Assert.assertEquals("cube_" + interleave.getHeaderValue(), cube.getName());
        }
    }

    @Test
    public void testSampleTypesAndByteOrder() throws Exception {
        double[][][] spectra = gradientCube(3, 2, 2);
        Path root = folder.getRoot().toPath();

        for (EnviDataType type : new EnviDataType[] {EnviDataType.INT16, EnviDataType.INT32, EnviDataType.FLOAT32, EnviDataType.FLOAT64}) {
            for (boolean littleEndian : new boolean[] {true, false}) {
                Path header = root.resolve(type + "_" + littleEndian + ".hdr");
                TestRasters.writeCube(header, spectra, null, Interleave.BIP, type, littleEndian);

                assertCube(spectra, EnviReader.readCube(header));
            }
        }
    }

    @Test
    public void testDoubleSamplesReadAtFloatPrecision() throws Exception {
        Path header = folder.getRoot().toPath().resolve("double.hdr");
        TestRasters.writeCube(header, new double[][][] {{{0.1, 1.0 / 3, 682.3093}}}, null, Interleave.BSQ, EnviDataType.FLOAT64, true);

        double[] spectrum = EnviReader.readCube(header).getSpectrum(0, 0);

        Assert.assertArrayEquals(new double[] {(float) 0.1, (float) (1.0 / 3), (float) 682.3093}, spectrum, 0);
    }

    @Test
    public void testUnsignedSamples() throws Exception {
        double[][][] spectra = {{{0, 200}, {255, 65535}}};
        Path root = folder.getRoot().toPath();

        TestRasters.writeCube(root.resolve("u16.hdr"), spectra, null, Interleave.BSQ, EnviDataType.UINT16, true);
        assertCube(spectra, EnviReader.readCube(root.resolve("u16.hdr")));

        double[][][] bytes = {{{0, 200}, {255, 7}}};
        TestRasters.writeCube(root.resolve("u8.hdr"), bytes, null, Interleave.BIL, EnviDataType.BYTE, true);
        assertCube(bytes, EnviReader.readCube(root.resolve("u8.hdr")));
    }

    @Test
    public void testWavelengthsNormalisedToNanometres() throws Exception {
        RasterMetadata metadata = new RasterMetadata();
        metadata.putNumbers(RasterMetadata.WAVELENGTH, new double[] {0.4, 0.5});
        metadata.put(RasterMetadata.WAVELENGTH_UNITS, "Micrometers");
        metadata.put(RasterMetadata.DATA_IGNORE_VALUE, "-9999");

        Path header = folder.getRoot().toPath().resolve("um.hdr");
        TestRasters.writeCube(header, gradientCube(2, 2, 2), metadata);

        RasterCube cube = EnviReader.readCube(header);
        Assert.assertArrayEquals(new double[] {400, 500}, cube.getWavelengths(), 1e-9);
        Assert.assertEquals(-9999, cube.getDataIgnoreValue().getAsDouble(), 0);
    }

    @Test(expected = IOException.class)
    public void testTruncatedDataFile() throws Exception {
        Path header = folder.getRoot().toPath().resolve("short.hdr");
        Path data = TestRasters.writeCube(header, gradientCube(4, 4, 2), null);

        byte[] bytes = Files.readAllBytes(data);
        Files.write(data, Arrays.copyOf(bytes, bytes.length - 1));

        EnviReader.readCube(header);
    }

    @Test
    public void testMissingRequiredField() throws Exception {
        Path header = folder.getRoot().toPath().resolve("nolines.hdr");
        TestRasters.writeCube(header, gradientCube(2, 2, 1), null);

        RasterMetadata metadata = EnviHeader.read(header);
        metadata.remove(RasterMetadata.LINES);
        EnviHeader.write(metadata, header);

        try {
            EnviReader.readCube(header);
            Assert.fail("expected IOException");
        } catch (IOException e) {
            Assert.assertTrue(e.getMessage().contains(header.toString()));
            Assert.assertTrue(e.getMessage().contains("lines"));
        }
    }

    @Test(expected = IOException.class)
    public void testWavelengthCountMismatch() throws Exception {
        Path header = folder.getRoot().toPath().resolve("bands.hdr");
        TestRasters.writeCube(header, gradientCube(2, 2, 3), TestRasters.metadataWithWavelengths(new double[] {400, 410}));

        EnviReader.readCube(header);
    }

    @Test
    public void testWriteFloatStack() throws Exception {
        double[][][] spectra = gradientCube(3, 4, 3);
        ImageStack stack = new ImageStack(3, 4);
        for (int b = 0; b < 3; b++) {
            float[] pixels = new float[12];
            for (int i = 0; i < pixels.length; i++)
                pixels[i] = (float) spectra[i / 3][i % 3][b];
            stack.addSlice(null, new FloatProcessor(3, 4, pixels));
        }

        RasterMetadata metadata = new RasterMetadata();
        metadata.put(RasterMetadata.MAP_INFO, "{UTM, 1, 1}");
        metadata.put(RasterMetadata.INTERLEAVE, "bip");

        Path header = folder.getRoot().toPath().resolve("written.hdr");
        EnviWriter.write(header, stack, EnviDataType.FLOAT32, metadata);

        RasterMetadata written = EnviHeader.read(header);
        Assert.assertEquals("bsq", written.getString(RasterMetadata.INTERLEAVE));
        Assert.assertEquals("{UTM, 1, 1}", written.get(RasterMetadata.MAP_INFO));
        Assert.assertEquals(EnviWriter.ENVI_STANDARD, written.getString(RasterMetadata.FILE_TYPE));
        Assert.assertEquals(3 * 4 * 3 * 4, Files.size(folder.getRoot().toPath().resolve("written.img")));

        assertCube(spectra, EnviReader.readCube(header));
        assertNoPartFiles();
    }

    @Test
    public void testWriteUnsignedShortSingleBand() throws Exception {
        short[] ids = {0, 1, 2, (short) 65535};
        ImageStack stack = new ImageStack(2, 2);
        stack.addSlice(null, new ShortProcessor(2, 2, ids, null));

        Path header = folder.getRoot().toPath().resolve("ids.hdr");
        EnviWriter.write(header, stack, EnviDataType.UINT16, new RasterMetadata());

        RasterCube cube = EnviReader.readCube(header);
        Assert.assertEquals(65535, cube.getSample(1, 1, 0), 0);
        Assert.assertEquals(12, EnviHeader.read(header).getInt(RasterMetadata.DATA_TYPE).getAsInt());
        assertNoPartFiles();
    }

    @Test
    public void testMismatchedPixelTypeLeavesNothingBehind() throws Exception {
        ImageStack stack = new ImageStack(2, 2);
        stack.addSlice(null, new ByteProcessor(2, 2));

        Path header = folder.getRoot().toPath().resolve("bad.hdr");
        try {
            EnviWriter.write(header, stack, EnviDataType.FLOAT32, new RasterMetadata());
            Assert.fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            Assert.assertFalse(Files.exists(header));
            assertNoPartFiles();
        }
    }

    @Test
    public void testOldHeaderNeverDescribesNewData() throws Exception {
        Path root = folder.getRoot().toPath();
        Path header = root.resolve("ids.hdr");
        Path data = root.resolve("ids.img");
        Files.write(data, new byte[] {1, 2, 3, 4});
        // a header that cannot be removed blocks the rewrite before the data is replaced
        Files.createDirectories(header);
        Files.write(header.resolve("occupied"), new byte[] {0});

        ImageStack stack = new ImageStack(2, 1);
        stack.addSlice(null, new FloatProcessor(2, 1, new float[] {5, 6}));
        try {
            EnviWriter.write(header, stack, EnviDataType.FLOAT32, new RasterMetadata());
            Assert.fail("expected IOException");
        } catch (IOException e) {
            Assert.assertArrayEquals(new byte[] {1, 2, 3, 4}, Files.readAllBytes(data));
            assertNoPartFiles();
        }
    }

    private void assertNoPartFiles() throws IOException {
        try (Stream<Path> files = Files.list(folder.getRoot().toPath())) {
            List<Path> parts = files.filter(p -> p.toString().endsWith(EnviWriter.PART_SUFFIX)).collect(Collectors.toList());
            Assert.assertTrue("left behind: " + parts, parts.isEmpty());
        }
    }
}
