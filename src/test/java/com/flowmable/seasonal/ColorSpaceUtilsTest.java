package com.flowmable.seasonal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validates hex parsing and sRGB→XYZ→Lab conversion against published reference values.
 */
class ColorSpaceUtilsTest {

    @Test
    void hexToLab_pureWhite() {
        Lab lab = ColorSpaceUtils.hexToLab("#FFFFFF");
        assertEquals(100.0, lab.l(), 0.01);
        assertEquals(0.0, lab.a(), 0.01);
        assertEquals(0.0, lab.b(), 0.01);
    }

    @Test
    void hexToLab_pureBlack() {
        Lab lab = ColorSpaceUtils.hexToLab("#000000");
        assertEquals(0.0, lab.l(), 0.001);
        assertEquals(0.0, lab.a(), 0.001);
        assertEquals(0.0, lab.b(), 0.001);
    }

    @Test
    void hexToLab_pureRed() {
        Lab lab = ColorSpaceUtils.hexToLab("#FF0000");
        assertEquals(53.24, lab.l(), 0.1);  // L*
        assertEquals(80.09, lab.a(), 0.1);  // a* positive (red)
        assertEquals(67.20, lab.b(), 0.1);  // b* positive
    }

    @Test
    void hexToLab_pureGreen() {
        Lab lab = ColorSpaceUtils.hexToLab("#00FF00");
        assertEquals(87.7, lab.l(), 0.5);
        assertTrue(lab.a() < -70);
    }

    @Test
    void hexToLab_midGray() {
        Lab lab = ColorSpaceUtils.hexToLab("#808080");
        assertEquals(53.6, lab.l(), 0.1);
        assertEquals(0.0, lab.a(), 0.01);
        assertEquals(0.0, lab.b(), 0.01);
    }

    @Test
    void hexToRgb_shortFormExpands() {
        assertEquals(ColorSpaceUtils.hexToRgb("#aabbcc"), ColorSpaceUtils.hexToRgb("#abc"));
        assertEquals(new Rgb(0xAA, 0xBB, 0xCC), ColorSpaceUtils.hexToRgb("#abc"));
    }

    @Test
    void hexToRgb_hashOptionalAndCaseInsensitive() {
        Rgb expected = new Rgb(0x1E, 0x3A, 0x8A);
        assertEquals(expected, ColorSpaceUtils.hexToRgb("1E3A8A"));
        assertEquals(expected, ColorSpaceUtils.hexToRgb("#1e3a8a"));
        assertEquals(expected, ColorSpaceUtils.hexToRgb("  #1E3A8A  "));
    }

    @Test
    void hexToRgb_malformedReturnsNull() {
        assertNull(ColorSpaceUtils.hexToRgb(null));
        assertNull(ColorSpaceUtils.hexToRgb(""));
        assertNull(ColorSpaceUtils.hexToRgb("#"));
        assertNull(ColorSpaceUtils.hexToRgb("#1234"));
        assertNull(ColorSpaceUtils.hexToRgb("#12345"));
        assertNull(ColorSpaceUtils.hexToRgb("#1234567"));
        assertNull(ColorSpaceUtils.hexToRgb("zz0000"));
        assertNull(ColorSpaceUtils.hexToRgb("#GG0000"));
    }

    @Test
    void hexToRgb_nonAsciiDigitsReturnNull() {
        assertNull(ColorSpaceUtils.hexToRgb("#\u0663\u0663\u0663"));    // Arabic-Indic digits
        assertNull(ColorSpaceUtils.hexToRgb("\uFF21\uFF22\uFF23"));     // fullwidth A-C
        assertNull(ColorSpaceUtils.hexToRgb("#\uFF10\uFF10\uFF10\uFF10\uFF10\uFF10")); // fullwidth 0
    }

    @Test
    void hexToLab_malformedReturnsNull() {
        assertNull(ColorSpaceUtils.hexToLab("not-a-color"));
        assertNull(ColorSpaceUtils.hexToLab(null));
    }

    @Test
    void rgbToXyz_whiteIsD65WhitePoint() {
        Xyz xyz = ColorSpaceUtils.rgbToXyz(new Rgb(255, 255, 255));
        assertEquals(95.047, xyz.x(), 0.01);
        assertEquals(100.0, xyz.y(), 0.01);
        assertEquals(108.883, xyz.z(), 0.01);
    }

    @Test
    void rgbToHex_uppercaseWithHash() {
        assertEquals("#1E3A8A", ColorSpaceUtils.rgbToHex(new Rgb(30, 58, 138)));
        assertEquals("#000000", ColorSpaceUtils.rgbToHex(new Rgb(0, 0, 0)));
    }

    @Test
    void lab_chromaAndHue() {
        Lab lab = new Lab(50.0, 3.0, 4.0);
        assertEquals(5.0, lab.chroma(), 1e-9);
        assertEquals(Math.toDegrees(Math.atan2(4.0, 3.0)), lab.hueDegrees(), 1e-9);

        Lab blue = new Lab(50.0, 0.0, -10.0);
        assertEquals(270.0, blue.hueDegrees(), 1e-9);
    }
}
