package mineralmap.library;

import mineralmap.raster.BandMismatchException;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class LibraryResamplerTest {

    private static final ReferenceLibrary LIBRARY = new ReferenceLibrary(Arrays.asList(
            new ReferenceSpectrum("Ramp", new double[] {1, 2, 3, 4}),
            new ReferenceSpectrum("Step", new double[] {1, 1, 5, 5})),
            new double[] {400, 410, 420, 430});

    @Test
    public void testLinearInterpolation() {
        ReferenceLibrary resampled = LibraryResampler.resample(LIBRARY, new double[] {400, 405, 415, 430});

        Assert.assertArrayEquals(new double[] {400, 405, 415, 430}, resampled.getWavelengths(), 0);
        Assert.assertArrayEquals(new double[] {1, 1.5, 2.5, 4}, resampled.get(0).getValues(), 1e-12);
        Assert.assertArrayEquals(new double[] {1, 1, 3, 5}, resampled.get(1).getValues(), 1e-12);
        Assert.assertEquals(LIBRARY.getNames(), resampled.getNames());
    }

    @Test(expected = BandMismatchException.class)
    public void testTargetOutsideLibrary() {
        LibraryResampler.resample(LIBRARY, new double[] {395, 420});
    }

    @Test(expected = BandMismatchException.class)
    public void testLibraryWithoutWavelengths() {
        ReferenceLibrary library = new ReferenceLibrary(
                Collections.singletonList(new ReferenceSpectrum("A", new double[] {1, 2})), new double[0]);
        LibraryResampler.resample(library, new double[] {400, 410});
    }
}
