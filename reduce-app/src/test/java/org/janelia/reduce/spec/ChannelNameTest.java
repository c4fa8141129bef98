package org.janelia.reduce.spec;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ChannelName} class.
 *
 * @author Eric Trautman
 */
public class ChannelNameTest {

    @Test
    public void testParsing() {

        final ChannelName simple = new ChannelName("beauty.R");
        Assert.assertEquals("invalid base", "beauty", simple.getBase());
        Assert.assertEquals("invalid component", "R", simple.getComponent());

        final ChannelName nested = new ChannelName("paint.coloroverride.G");
        Assert.assertEquals("invalid nested base", "paint.coloroverride", nested.getBase());
        Assert.assertEquals("invalid nested component", "G", nested.getComponent());

        final ChannelName bare = new ChannelName("depth");
        Assert.assertEquals("invalid bare base", "depth", bare.getBase());
        Assert.assertEquals("invalid bare component", "", bare.getComponent());
    }

    @Test
    public void testContainsIgnoreCase() {
        final ChannelName name = new ChannelName("FX_Matte.A");
        Assert.assertTrue(name.containsIgnoreCase("matte"));
        Assert.assertFalse(name.containsIgnoreCase("tonal"));
    }

    @Test
    public void testMaskName() {
        Assert.assertEquals("paint.coloroverride.mask", ChannelName.maskNameForBase("paint.coloroverride"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyName() {
        new ChannelName("");
    }
}
