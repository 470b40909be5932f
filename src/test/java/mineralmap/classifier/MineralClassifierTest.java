package mineralmap.classifier;

import mineralmap.TestRasters;
import mineralmap.library.InvalidLibraryException;
import mineralmap.library.ReferenceLibrary;
import mineralmap.library.ReferenceSpectrum;
import mineralmap.raster.BandMismatchException;
import mineralmap.raster.RasterMetadata;
import mineralmap.raster.StackRasterCube;
import mineralmap.util.CancellationSignal;
import mineralmap.util.ProcessingContext;
import org.junit.Assert;
import org.junit.Test;

import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class MineralClassifierTest {

    private static final double[] ALUNITE = {0.25, 0.5, 0.75, 0.5};
    private static final double[] KAOLINITE = {0.75, 0.5, 0.25, 0.125};

    private static ReferenceLibrary library(Object... namesAndSpectra) {
        List<ReferenceSpectrum> spectra = new ArrayList<>();
        for (int i = 0; i < namesAndSpectra.length; i += 2)
            spectra.add(new ReferenceSpectrum((String) namesAndSpectra[i], (double[]) namesAndSpectra[i + 1]));
        return new ReferenceLibrary(spectra, new double[0]);
    }

    private static StackRasterCube cube(double[][][] spectra) {
        return StackRasterCube.fromSpectra("test", spectra, new RasterMetadata());
    }

    private static StackRasterCube randomCube(int width, int height, int bands, long seed) {
        Random random = new Random(seed);
        double[][][] spectra = new double[height][width][bands];
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                for (int b = 0; b < bands; b++)
                    spectra[y][x][b] = random.nextDouble();
        return cube(spectra);
    }

    private static ReferenceLibrary randomLibrary(int size, int bands, long seed) {
        Random random = new Random(seed);
        List<ReferenceSpectrum> spectra = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            double[] values = new double[bands];
            for (int b = 0; b < bands; b++)
                values[b] = 0.05 + random.nextDouble();
            spectra.add(new ReferenceSpectrum("Mineral " + i, values));
        }
        return new ReferenceLibrary(spectra, new double[0]);
    }

    private static int countNoData(ClassifiedImage image) {
        int count = 0;
        for (int y = 0; y < image.getHeight(); y++)
            for (int x = 0; x < image.getWidth(); x++)
                if (image.getClassId(x, y) == ClassCatalog.NO_DATA_ID)
                    count++;
        return count;
    }

    @Test
    public void testExactMatchAssignedToLibraryEntry() throws Exception {
        ReferenceLibrary library = library("Alunite", ALUNITE, "Kaolinite", KAOLINITE);

        ClassifiedImage result = MineralClassifier.classifyImage(cube(new double[][][] {{ALUNITE, KAOLINITE}}),
                library, ClassificationConfig.defaults());

        Assert.assertEquals(Arrays.asList(ClassCatalog.NO_DATA, "Alunite", "Kaolinite"), result.getCatalog().getNames());
        Assert.assertEquals("Alunite", result.getClassName(0, 0));
        Assert.assertEquals("Kaolinite", result.getClassName(1, 0));
    }

    @Test
    public void testThresholdRejectsWeakMatch() throws Exception {
        // 45 degrees from Alunite, i.e. similarity 0.5, and 90 degrees from Kaolinite
        double[] pixel = {1, 1, 0};
        ReferenceLibrary library = library("Alunite", new double[] {1, 0, 0}, "Kaolinite", new double[] {0, 0, 1});
        StackRasterCube image = cube(new double[][][] {{pixel}});

        ClassifiedImage unthresholded = MineralClassifier.classifyImage(image, library, ClassificationConfig.defaults());
        Assert.assertEquals("Alunite", unthresholded.getClassName(0, 0));

        ClassifiedImage strict = MineralClassifier.classifyImage(image, library, ClassificationConfig.defaults().withThreshold(0.99));
        Assert.assertEquals(ClassCatalog.NO_DATA, strict.getClassName(0, 0));

        ClassifiedImage lenient = MineralClassifier.classifyImage(image, library, ClassificationConfig.defaults().withThreshold(0.4));
        Assert.assertEquals("Alunite", lenient.getClassName(0, 0));
    }

    @Test
    public void testRaisingThresholdOnlyAddsNoData() throws Exception {
        StackRasterCube image = randomCube(20, 15, 6, 1);
        ReferenceLibrary library = randomLibrary(5, 6, 2);

        ClassifiedImage unthresholded = MineralClassifier.classifyImage(image, library, ClassificationConfig.defaults());
        int previousNoData = countNoData(unthresholded);

        for (double threshold = 0; threshold <= 1.0; threshold += 0.05) {
            ClassifiedImage result = MineralClassifier.classifyImage(image, library,
                    ClassificationConfig.defaults().withThreshold(Math.min(1, threshold)));

            int noData = countNoData(result);
            Assert.assertTrue("threshold " + threshold, noData >= previousNoData);
            previousNoData = noData;

            for (int y = 0; y < image.getHeight(); y++)
                for (int x = 0; x < image.getWidth(); x++)
                    if (result.getClassId(x, y) != ClassCatalog.NO_DATA_ID)
                        Assert.assertEquals(unthresholded.getClassId(x, y), result.getClassId(x, y));
        }
    }

    @Test
    public void testEveryIdIsInCatalog() throws Exception {
        ClassifiedImage result = MineralClassifier.classifyImage(randomCube(13, 9, 4, 3), randomLibrary(7, 4, 4),
                ClassificationConfig.defaults());

        Assert.assertEquals(8, result.getCatalog().size());
        for (int y = 0; y < result.getHeight(); y++)
            for (int x = 0; x < result.getWidth(); x++)
                Assert.assertTrue(result.getCatalog().isValidId(result.getClassId(x, y)));
    }

    @Test
    public void testSubsetRestrictsClasses() throws Exception {
        ReferenceLibrary library = randomLibrary(6, 4, 5);
        List<String> subset = Arrays.asList("Mineral 4", "Mineral 1", "Unobtainium");

        ClassifiedImage result = MineralClassifier.classifyImage(randomCube(10, 10, 4, 6), library,
                ClassificationConfig.defaults().withClassNames(subset));

        // library order, not request order
        Assert.assertEquals(Arrays.asList(ClassCatalog.NO_DATA, "Mineral 1", "Mineral 4"), result.getCatalog().getNames());
        for (int y = 0; y < result.getHeight(); y++)
            for (int x = 0; x < result.getWidth(); x++) {
                String name = result.getClassName(x, y);
                Assert.assertTrue(name, name.equals(ClassCatalog.NO_DATA) || subset.contains(name));
            }
    }

    @Test(expected = EmptySubsetException.class)
    public void testEmptySubset() throws Exception {
        MineralClassifier.classifyImage(randomCube(2, 2, 4, 7), randomLibrary(3, 4, 8),
                ClassificationConfig.defaults().withClassNames(Collections.singletonList("Unobtainium")));
    }

    @Test(expected = BandMismatchException.class)
    public void testBandCountMismatch() throws Exception {
        MineralClassifier.classifyImage(randomCube(2, 2, 5, 9), randomLibrary(3, 4, 10), ClassificationConfig.defaults());
    }

    @Test(expected = BandMismatchException.class)
    public void testWavelengthMismatch() throws Exception {
        StackRasterCube image = StackRasterCube.fromSpectra("test", new double[][][] {{ALUNITE}},
                TestRasters.metadataWithWavelengths(new double[] {400, 410, 420, 430}));
        ReferenceLibrary library = new ReferenceLibrary(
                Collections.singletonList(new ReferenceSpectrum("Alunite", ALUNITE)), new double[] {400, 410, 425, 430});

        MineralClassifier.classifyImage(image, library, ClassificationConfig.defaults());
    }

    @Test
    public void testNoDataPixels() throws Exception {
        RasterMetadata metadata = new RasterMetadata();
        metadata.put(RasterMetadata.DATA_IGNORE_VALUE, "-9999");

        double[][][] spectra = {{
                {0, 0, 0, 0},
                {-9999, -9999, -9999, -9999},
                {Double.NaN, 0.5, 0.5, 0.5},
                ALUNITE
        }};

        ClassifiedImage result = MineralClassifier.classifyImage(StackRasterCube.fromSpectra("test", spectra, metadata),
                library("Alunite", ALUNITE), ClassificationConfig.defaults());

        Assert.assertEquals(0, result.getClassId(0, 0));
        Assert.assertEquals(0, result.getClassId(1, 0));
        Assert.assertEquals(0, result.getClassId(2, 0));
        Assert.assertEquals(1, result.getClassId(3, 0));
    }

    @Test
    public void testTiesGoToFirstEntry() throws Exception {
        ClassifiedImage result = MineralClassifier.classifyImage(cube(new double[][][] {{KAOLINITE}}),
                library("First", ALUNITE.clone(), "Second", ALUNITE.clone()), ClassificationConfig.defaults());

        Assert.assertEquals("First", result.getClassName(0, 0));
    }

    @Test
    public void testTiledEqualsSingleTile() throws Exception {
        StackRasterCube image = randomCube(17, 41, 5, 11);
        ReferenceLibrary library = randomLibrary(9, 5, 12);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            ClassifiedImage singleTile = MineralClassifier.classifyImage(image, library, ClassificationConfig.defaults(),
                    ProcessingContext.defaults().withTileRows(1000).withExecutor(executor));
            ClassifiedImage rowTiles = MineralClassifier.classifyImage(image, library, ClassificationConfig.defaults(),
                    ProcessingContext.defaults().withTileRows(1).withExecutor(executor));

            Assert.assertArrayEquals((short[]) singleTile.getClassIds().getPixels(), (short[]) rowTiles.getClassIds().getPixels());
        } finally {
            executor.shutdown();
        }
    }

    @Test
    public void testIgnoreValueNotExactInFloat() throws Exception {
        for (String ignoreValue : new String[] {"-0.1", "-9999.9"}) {
            RasterMetadata metadata = new RasterMetadata();
            metadata.put(RasterMetadata.DATA_IGNORE_VALUE, ignoreValue);
            double value = Double.parseDouble(ignoreValue);

            ClassifiedImage result = MineralClassifier.classifyImage(
                    StackRasterCube.fromSpectra("test", new double[][][] {{{value, value, value, value}}}, metadata),
                    library("Alunite", ALUNITE), ClassificationConfig.defaults());

            Assert.assertEquals(ignoreValue, ClassCatalog.NO_DATA, result.getClassName(0, 0));
        }
    }

    @Test
    public void testExactMatchPassesFullThreshold() throws Exception {
        StackRasterCube image = randomCube(6, 5, 50, 21);
        List<ReferenceSpectrum> spectra = new ArrayList<>();
        spectra.add(new ReferenceSpectrum("Pixel", image.getSpectrum(3, 2)));
        spectra.add(new ReferenceSpectrum("Other", randomCube(1, 1, 50, 22).getSpectrum(0, 0)));

        ClassifiedImage result = MineralClassifier.classifyImage(image, new ReferenceLibrary(spectra, new double[0]),
                ClassificationConfig.defaults().withThreshold(1));

        Assert.assertEquals("Pixel", result.getClassName(3, 2));
    }

    @Test(expected = InvalidLibraryException.class)
    public void testTooManyReferenceSpectra() throws Exception {
        List<ReferenceSpectrum> spectra = new ArrayList<>();
        for (int i = 0; i < ClassCatalog.MAX_CLASSES; i++)
            spectra.add(new ReferenceSpectrum("Mineral " + i, new double[] {1}));

        MineralClassifier.classifyImage(cube(new double[][][] {{{1}}}), new ReferenceLibrary(spectra, new double[0]),
                ClassificationConfig.defaults());
    }

    @Test(expected = CancellationException.class)
    public void testCancelled() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        MineralClassifier.classifyImage(randomCube(4, 4, 3, 13), randomLibrary(2, 3, 14), ClassificationConfig.defaults(),
                ProcessingContext.defaults().withCancellationSignal(signal));
    }

    @Test
    public void testMetadata() throws Exception {
        RasterMetadata source = new RasterMetadata();
        source.put(RasterMetadata.MAP_INFO, "{ UTM , 1.000 , 1.000 , 724522.127 }");
        source.put(RasterMetadata.SENSOR_TYPE, "AVIRIS-NG");

        ClassifiedImage result = MineralClassifier.classifyImage(
                StackRasterCube.fromSpectra("test", new double[][][] {{ALUNITE}}, source),
                library("Alunite", ALUNITE, "Kaolinite", KAOLINITE), ClassificationConfig.defaults());

        RasterMetadata metadata = result.getMetadata();
        Assert.assertEquals(ClassifiedImage.description(), metadata.getString(RasterMetadata.DESCRIPTION));
        Assert.assertTrue(metadata.getString(RasterMetadata.DESCRIPTION).endsWith("mineral classified image."));
        Assert.assertEquals(ClassifiedImage.FILE_TYPE, metadata.get(RasterMetadata.FILE_TYPE));
        Assert.assertEquals("{ UTM , 1.000 , 1.000 , 724522.127 }", metadata.get(RasterMetadata.MAP_INFO));
        Assert.assertEquals(3, metadata.getInt(RasterMetadata.CLASSES).getAsInt());
        Assert.assertEquals(Arrays.asList("No data", "Alunite", "Kaolinite"), metadata.getList(RasterMetadata.CLASS_NAMES));
        Assert.assertEquals(9, metadata.getList(RasterMetadata.CLASS_LOOKUP).size());
        Assert.assertFalse(metadata.containsKey(RasterMetadata.SENSOR_TYPE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testThresholdOutOfRange() {
        ClassificationConfig.defaults().withThreshold(1.5);
    }
}
