package mineralmap.classifier;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class ClassCatalogTest {

    @Test
    public void testWithNoData() {
        ClassCatalog catalog = ClassCatalog.withNoData(Arrays.asList("Alunite", "Kaolinite"));

        Assert.assertEquals(3, catalog.size());
        Assert.assertEquals(ClassCatalog.NO_DATA, catalog.getName(0));
        Assert.assertEquals(2, catalog.getId("Kaolinite"));
        Assert.assertEquals(-1, catalog.getId("Quartz"));
        Assert.assertTrue(catalog.hasNoData());
        Assert.assertTrue(catalog.isValidId(2));
        Assert.assertFalse(catalog.isValidId(3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNames() {
        new ClassCatalog(Arrays.asList("A", "B", "A"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoDataMustComeFirst() {
        new ClassCatalog(Arrays.asList("A", ClassCatalog.NO_DATA));
    }

    @Test
    public void testGrayLookup() {
        ClassCatalog catalog = ClassCatalog.withNoData(Arrays.asList("A", "B", "C"));

        Assert.assertArrayEquals(new int[] {0, 0, 0, 85, 85, 85, 170, 170, 170, 255, 255, 255}, catalog.getGrayLookup());
        Assert.assertArrayEquals(new int[] {0, 0, 0}, new ClassCatalog(Arrays.asList("A")).getGrayLookup());
    }

    @Test
    public void testGrayLookupForLargeLibrary() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < 1365; i++)
            names.add("Mineral " + i);

        int[] lookup = ClassCatalog.withNoData(names).getGrayLookup();

        Assert.assertEquals(1366 * 3, lookup.length);
        Assert.assertEquals(0, lookup[0]);
        Assert.assertEquals(255, lookup[1365 * 3]);
        for (int id = 1; id < 1366; id++) {
            Assert.assertTrue("class " + id, lookup[id * 3] >= lookup[(id - 1) * 3]);
            Assert.assertEquals(lookup[id * 3], lookup[id * 3 + 2]);
        }
        // only the classes nearest the start of the ramp share black with No data
        Assert.assertTrue(lookup[10 * 3] > 0);
        Assert.assertEquals(128, lookup[683 * 3]);
    }
}
