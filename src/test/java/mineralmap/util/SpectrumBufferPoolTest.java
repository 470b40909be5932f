package mineralmap.util;

import org.junit.Assert;
import org.junit.Test;

public class SpectrumBufferPoolTest {

    @Test
    public void testBuffersAreReused() {
        SpectrumBufferPool pool = new SpectrumBufferPool(2, 7);
        try {
            double[] first = pool.borrowSpectrum();
            Assert.assertEquals(7, first.length);
            pool.returnSpectrum(first);

            Assert.assertSame(first, pool.borrowSpectrum());
        } finally {
            pool.close();
        }
    }
}
