package mineralmap;

import mineralmap.util.MineralMapVersion;
import org.junit.Assert;
import org.junit.Test;

public class AboutMineralMapTest {

    @Test
    public void testTextNamesVersionAndSensors() {
        String text = AboutMineralMap.getText();

        Assert.assertTrue(text.startsWith("ABOUT " + MineralMapVersion.getNameAndVersion().toUpperCase()));
        Assert.assertTrue(text.contains("AVIRIS-NG"));
        Assert.assertTrue(text.contains("AVIRIS-C"));
    }
}
