package org.chaincraft.model;

import org.junit.Assert;
import org.junit.Test;

public class DigestTest {

  @Test
  public void hexIsLowerCaseAndParsesEitherCase() {
    Digest digest = Digest.fromHex("00FFa1");
    Assert.assertEquals("00ffa1", digest.toHex());
    Assert.assertEquals(digest, Digest.fromHex("00ffa1"));
    Assert.assertEquals(digest.hashCode(), Digest.fromHex("00ffa1").hashCode());
  }

  @Test
  public void ordersUnsigned() {
    Digest low = Digest.fromHex("7f00");
    Digest high = Digest.fromHex("8000");
    Assert.assertTrue(low.compareTo(high) < 0);
    Assert.assertTrue(high.compareTo(low) > 0);
    Assert.assertEquals(0, low.compareTo(Digest.fromHex("7f00")));
  }

  @Test
  public void countsLeadingZeroNibbles() {
    Assert.assertEquals(0, Digest.fromHex("f000").leadingZeroNibbles());
    Assert.assertEquals(1, Digest.fromHex("0f00").leadingZeroNibbles());
    Assert.assertEquals(3, Digest.fromHex("000f").leadingZeroNibbles());
    Assert.assertEquals(4, Digest.fromHex("0000").leadingZeroNibbles());
  }

  @Test
  public void bytesAreCopied() {
    byte[] raw = { 1, 2 };
    Digest digest = new Digest(raw);
    raw[0] = 9;
    digest.getBytes()[1] = 9;
    Assert.assertEquals("0102", digest.toHex());
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsOddLength() {
    Digest.fromHex("abc");
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsNonHex() {
    Digest.fromHex("zz");
  }
}
