package rss.specpol.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Pair;
import org.junit.Test;

public class StokesUtilsTest {

  private static double[][] stokes() {
    return new double[][]{
        {100., 200., 300.},
        {3., -4., 5.},
        {1., 2., -6.}};
  }

  private static double[][] variance() {
    return new double[][]{
        {10., 20., 30.},
        {0.5, 0.2, 0.9},
        {0.3, 0.7, 0.4},
        {0.05, -0.02, 0.1}};
  }

  @Test
  public void rotationByAngleAndItsNegativeRestoresInput() {
    double[][] stokes = stokes();
    double[][] variance = variance();
    double[] pa = {12.5, -33., 71.};
    double[] negative = {-12.5, 33., -71.};

    Pair<double[][], double[][]> rotated = StokesUtils.rotate(stokes, variance, pa, false);
    Pair<double[][], double[][]> restored = StokesUtils.rotate(rotated.getFirst(),
        rotated.getSecond(), negative, false);

    for (int f = 0; f < stokes.length; ++f) {
      assertArrayEquals(stokes[f], restored.getFirst()[f], 1E-10);
    }
    for (int f = 0; f < variance.length; ++f) {
      assertArrayEquals(variance[f], restored.getSecond()[f], 1E-10);
    }
  }

  @Test
  public void scalarAngleAppliesToAllWavelengths() {
    Pair<double[][], double[][]> rotated =
        StokesUtils.rotate(stokes(), variance(), new double[]{22.5}, false);
    Pair<double[][], double[][]> perWavelength =
        StokesUtils.rotate(stokes(), variance(), new double[]{22.5, 22.5, 22.5}, false);
    for (int f = 0; f < 3; ++f) {
      assertArrayEquals(perWavelength.getFirst()[f], rotated.getFirst()[f], 0.);
    }
    for (int f = 0; f < 4; ++f) {
      assertArrayEquals(perWavelength.getSecond()[f], rotated.getSecond()[f], 0.);
    }
  }

  @Test
  public void ninetyDegreesFlipsQAndU() {
    Pair<double[][], double[][]> rotated =
        StokesUtils.rotate(stokes(), variance(), new double[]{90.}, false);
    double[][] out = rotated.getFirst();
    assertArrayEquals(new double[]{100., 200., 300.}, out[0], 0.);
    assertArrayEquals(new double[]{-3., 4., -5.}, out[1], 1E-12);
    assertArrayEquals(new double[]{-1., -2., 6.}, out[2], 1E-12);
    // variance and covariance are unchanged by a sign flip of both
    for (int f = 0; f < 4; ++f) {
      assertArrayEquals(variance()[f], rotated.getSecond()[f], 1E-12);
    }
  }

  @Test
  public void rotatesPolarizationByTwiceTheAngle() {
    double[][] qu = {{1.}, {0.}};
    double[][] variance = {{1.}, {0.}, {0.}};
    Pair<double[][], double[][]> rotated =
        StokesUtils.rotate(qu, variance, new double[]{22.5}, true);
    double half = FastMath.sqrt(0.5);
    assertEquals(half, rotated.getFirst()[0][0], 1E-12);
    assertEquals(half, rotated.getFirst()[1][0], 1E-12);
    assertEquals(0.5, rotated.getSecond()[0][0], 1E-12);
    assertEquals(0.5, rotated.getSecond()[1][0], 1E-12);
    assertEquals(0.5, rotated.getSecond()[2][0], 1E-12);
  }

  @Test
  public void inputIsNotModified() {
    double[][] stokes = stokes();
    double[][] variance = variance();
    StokesUtils.rotate(stokes, variance, new double[]{45.}, false);
    for (int f = 0; f < 3; ++f) {
      assertArrayEquals(stokes()[f], stokes[f], 0.);
    }
    for (int f = 0; f < 4; ++f) {
      assertArrayEquals(variance()[f], variance[f], 0.);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void angleLengthMismatchThrows() {
    StokesUtils.rotate(stokes(), variance(), new double[]{1., 2.}, false);
  }

  @Test
  public void rotateNormalizedMatchesRotation() {
    double[][] qu = {{0.01, 0.02}, {0., -0.01}};
    double[][] rotated = StokesUtils.rotateNormalized(qu, new double[]{45., 90.});
    assertArrayEquals(new double[]{0., -0.02}, rotated[0], 1E-15);
    assertArrayEquals(new double[]{0.01, 0.01}, rotated[1], 1E-15);
  }

  @Test
  public void normalizeSkipsInvalidWavelengths() {
    double[] intensity = {100., 0., 50.};
    double[] difference = {2., 1., -1.};
    boolean[] ok = {true, false, true};
    assertArrayEquals(new double[]{0.02, 0., -0.02},
        StokesUtils.normalize(intensity, difference, ok), 1E-15);
    assertArrayEquals(new double[]{2E-4, 0., -4E-4},
        StokesUtils.normalizeVariance(intensity, difference, ok), 1E-15);
  }
}
