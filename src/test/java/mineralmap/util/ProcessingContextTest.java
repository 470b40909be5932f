package mineralmap.util;

import org.junit.Assert;
import org.junit.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class ProcessingContextTest {

    @Test
    public void testDefaults() {
        ProcessingContext context = ProcessingContext.defaults();

        Assert.assertEquals(ProcessingContext.DEFAULT_TILE_ROWS, context.getTileRows());
        Assert.assertSame(MineralMapEnvironment.getProcessingExecutor(), context.getExecutor());
        Assert.assertFalse(context.getCancellationSignal().isCancelled());
        Assert.assertNotNull(context.getLog());
    }

    @Test
    public void testWithReturnsModifiedCopy() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            ProcessingContext defaults = ProcessingContext.defaults();
            ProcessingContext modified = defaults.withTileRows(5).withExecutor(executor);

            Assert.assertEquals(ProcessingContext.DEFAULT_TILE_ROWS, defaults.getTileRows());
            Assert.assertEquals(5, modified.getTileRows());
            Assert.assertSame(executor, modified.getExecutor());
            Assert.assertSame(defaults.getLog(), modified.getLog());
        } finally {
            executor.shutdown();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTileRowsMustBePositive() {
        ProcessingContext.defaults().withTileRows(0);
    }
}
