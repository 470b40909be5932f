package mineralmap.library;

import mineralmap.TestRasters;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;

public class SpectralLibraryReaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testReadLibrary() throws Exception {
        Path header = folder.getRoot().toPath().resolve("s06av95a_envi.hdr");
        TestRasters.writeLibrary(header,
                TestRasters.names("Alunite GDS84 Na03", "Kaolinite CM9"),
                new double[][] {{0.25, 0.5, 0.75}, {0.5, 0.25, 0.125}},
                new double[] {0.4, 0.5, 0.6}, "Micrometers");

        ReferenceLibrary library = SpectralLibraryReader.read(header);

        Assert.assertEquals(2, library.size());
        Assert.assertEquals("Alunite GDS84 Na03", library.get(0).getName());
        Assert.assertArrayEquals(new double[] {0.5, 0.25, 0.125}, library.get(1).getValues(), 0);
        Assert.assertArrayEquals(new double[] {400, 500, 600}, library.getWavelengths(), 1e-9);
    }

    @Test
    public void testLibraryWithoutWavelengths() throws Exception {
        Path header = folder.getRoot().toPath().resolve("plain.hdr");
        TestRasters.writeLibrary(header, TestRasters.names("A"), new double[][] {{1, 2}}, null, null);

        Assert.assertFalse(SpectralLibraryReader.read(header).hasWavelengths());
    }

    @Test(expected = IOException.class)
    public void testNameCountMismatch() throws Exception {
        Path header = folder.getRoot().toPath().resolve("names.hdr");
        TestRasters.writeLibrary(header, TestRasters.names("A"), new double[][] {{1, 2}, {2, 1}}, null, null);

        SpectralLibraryReader.read(header);
    }

    @Test(expected = InvalidLibraryException.class)
    public void testDuplicateNamesRejected() throws Exception {
        Path header = folder.getRoot().toPath().resolve("dupes.hdr");
        TestRasters.writeLibrary(header, TestRasters.names("A", "A"), new double[][] {{1, 2}, {2, 1}}, null, null);

        SpectralLibraryReader.read(header);
    }
}
