package mineralmap.library;

import mineralmap.classifier.ClassCatalog;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

public class ReferenceLibraryTest {

    private static ReferenceSpectrum spectrum(String name, double... values) {
        return new ReferenceSpectrum(name, values);
    }

    @Test
    public void testValidLibrary() {
        ReferenceLibrary library = new ReferenceLibrary(Arrays.asList(
                spectrum("Alunite", 0.1, 0.2),
                spectrum("Kaolinite", 0.3, 0.1)), new double[] {400, 410});

        Assert.assertEquals(2, library.size());
        Assert.assertEquals(2, library.getNumBands());
        Assert.assertEquals(Arrays.asList("Alunite", "Kaolinite"), library.getNames());
        Assert.assertEquals(1, library.indexOf("Kaolinite"));
        Assert.assertEquals(-1, library.indexOf("Quartz"));
        Assert.assertTrue(library.hasWavelengths());
    }

    @Test(expected = InvalidLibraryException.class)
    public void testEmpty() {
        new ReferenceLibrary(new ArrayList<>(), new double[0]);
    }

    @Test(expected = InvalidLibraryException.class)
    public void testDifferingLengths() {
        new ReferenceLibrary(Arrays.asList(spectrum("A", 1, 2), spectrum("B", 1, 2, 3)), new double[0]);
    }

    @Test(expected = InvalidLibraryException.class)
    public void testAxisLengthMismatch() {
        new ReferenceLibrary(Collections.singletonList(spectrum("A", 1, 2)), new double[] {400, 410, 420});
    }

    @Test(expected = InvalidLibraryException.class)
    public void testDuplicateNames() {
        new ReferenceLibrary(Arrays.asList(spectrum("A", 1, 2), spectrum("A", 2, 1)), new double[0]);
    }

    @Test(expected = InvalidLibraryException.class)
    public void testReservedName() {
        new ReferenceLibrary(Collections.singletonList(spectrum(ClassCatalog.NO_DATA, 1, 2)), new double[0]);
    }

    @Test(expected = InvalidLibraryException.class)
    public void testZeroSpectrum() {
        new ReferenceLibrary(Collections.singletonList(spectrum("A", 0, 0)), new double[0]);
    }

    @Test(expected = InvalidLibraryException.class)
    public void testNonFiniteValue() {
        new ReferenceLibrary(Collections.singletonList(spectrum("A", 1, Double.NaN)), new double[0]);
    }
}
