package com.example.casa.service;

import com.example.casa.config.CasaProperties;
import com.example.casa.dto.MotilityClass;
import com.example.casa.dto.SpermDetection;
import com.example.casa.dto.TrackKinematics;
import com.example.casa.exception.InvalidTrackException;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.example.casa.service.CasaTestData.point;
import static org.junit.Assert.*;

public class TrackKinematicsCalculatorTest {

    private static final double EPS = 1e-9;

    private CasaProperties properties;
    private TrackKinematicsCalculator calculator;

    @Before
    public void setUp() {
        properties = CasaTestData.properties();
        calculator = new TrackKinematicsCalculator(properties);
    }

    @Test
    public void testStraightThreePointTrack() {
        properties.getMotility().setVclProgressive(20.0);
        properties.getMotility().setVslProgressive(20.0);

        TrackKinematics k = calculator.calculate(List.of(
                point(0, 0, 0.0),
                point(10, 0, 0.5),
                point(20, 0, 1.0)));

        assertEquals(20.0, k.getVcl(), EPS);
        assertEquals(20.0, k.getVsl(), EPS);
        assertEquals("点数不足5时VAP取VSL", 20.0, k.getVap(), EPS);
        assertEquals(100.0, k.getLin(), EPS);
        assertEquals(100.0, k.getStr(), EPS);
        assertEquals(100.0, k.getWob(), EPS);
        assertEquals(0.0, k.getAlh(), EPS);
        assertEquals(0.0, k.getBcf(), EPS);
        assertEquals(MotilityClass.PROGRESSIVE, k.getMotilityClass());
    }

    @Test
    public void testCalibrationScalesVelocities() {
        properties.getCalibration().setMicronsPerPixel(0.5);

        TrackKinematics k = calculator.calculate(List.of(
                point(0, 0, 0.0),
                point(10, 0, 0.5),
                point(20, 0, 1.0)));

        assertEquals(10.0, k.getVcl(), EPS);
        assertEquals(10.0, k.getVsl(), EPS);
    }

    @Test(expected = InvalidTrackException.class)
    public void testSinglePointRejected() {
        calculator.calculate(List.of(point(0, 0, 0.0)));
    }

    @Test(expected = InvalidTrackException.class)
    public void testTwoPointsRejected() {
        calculator.calculate(List.of(point(0, 0, 0.0), point(1, 1, 0.1)));
    }

    @Test(expected = InvalidTrackException.class)
    public void testEmptyTrackRejected() {
        calculator.calculate(List.of());
    }

    @Test
    public void testNonIncreasingTimestampsRejected() {
        try {
            calculator.calculate(List.of(
                    point(0, 0, 0.0),
                    point(1, 0, 0.1),
                    point(2, 0, 0.1)));
            fail("时间戳重复应抛出异常");
        } catch (InvalidTrackException e) {
            assertTrue(e.getMessage().contains("Timestamps not strictly increasing"));
        }
    }

    @Test(expected = InvalidTrackException.class)
    public void testNonFiniteCoordinateRejected() {
        calculator.calculate(List.of(
                point(0, 0, 0.0),
                point(Double.NaN, 0, 0.1),
                point(2, 0, 0.2)));
    }

    @Test
    public void testRandomTracksStayWithinBounds() {
        Random random = new Random(42);
        for (int trial = 0; trial < 500; trial++) {
            int n = 3 + random.nextInt(40);
            List<SpermDetection> track = new ArrayList<>();
            double x = random.nextDouble() * 500;
            double y = random.nextDouble() * 500;
            double t = random.nextDouble();
            for (int i = 0; i < n; i++) {
                track.add(point(x, y, t));
                x += random.nextGaussian() * 5;
                y += random.nextGaussian() * 5;
                t += 0.01 + random.nextDouble() * 0.05;
            }

            TrackKinematics k = calculator.calculate(track);

            assertTrue("VCL >= VSL", k.getVcl() + EPS >= k.getVsl());
            assertTrue("VCL >= VAP", k.getVcl() + EPS >= k.getVap());
            assertTrue("VAP >= VSL", k.getVap() + EPS >= k.getVsl());
            assertInPercentRange("LIN", k.getLin());
            assertInPercentRange("STR", k.getStr());
            assertInPercentRange("WOB", k.getWob());
            assertTrue("ALH >= 0", k.getAlh() >= 0);
            assertTrue("BCF >= 0", k.getBcf() >= 0);
            assertNotNull(k.getMotilityClass());
        }
    }

    @Test
    public void testZigZagTrackHasBeatCrossAndLateralAmplitude() {
        double[] lateral = {0, 3, -3, 3, -3, 3, -3, 3, -3, 0};
        List<SpermDetection> track = new ArrayList<>();
        for (int i = 0; i < lateral.length; i++) {
            track.add(point(i * 10.0, lateral[i], i * 0.1));
        }

        TrackKinematics k = calculator.calculate(track);

        // 7次过零，0.9秒
        assertEquals(3.5 / 0.9, k.getBcf(), 1e-6);
        assertTrue("ALH应大于0", k.getAlh() > 0);
        assertTrue(k.getVap() < k.getVcl());
        assertTrue(k.getLin() < 100.0);
    }

    @Test
    public void testShortTrackHasNoBeatCross() {
        TrackKinematics k = calculator.calculate(List.of(
                point(0, 0, 0.0),
                point(10, 3, 0.1),
                point(20, -3, 0.2),
                point(30, 0, 0.3)));

        assertEquals(0.0, k.getBcf(), 0.0);
    }

    @Test
    public void testClosedLoopHasZeroBeatCross() {
        TrackKinematics k = calculator.calculate(List.of(
                point(0, 0, 0.0),
                point(10, 0, 0.1),
                point(10, 10, 0.2),
                point(0, 10, 0.3),
                point(0, 0, 0.4)));

        assertEquals(0.0, k.getVsl(), EPS);
        assertEquals(0.0, k.getBcf(), 0.0);
        assertEquals(0.0, k.getLin(), EPS);
    }

    @Test
    public void testVerticalTrackHasFiniteLateralAmplitude() {
        TrackKinematics k = calculator.calculate(List.of(
                point(5, 0, 0.0),
                point(5, 10, 0.1),
                point(5, 20, 0.2),
                point(5, 30, 0.3),
                point(5, 40, 0.4)));

        assertTrue(Double.isFinite(k.getAlh()));
        assertEquals(0.0, k.getAlh(), EPS);
        assertEquals(100.0, k.getLin(), EPS);
    }

    @Test
    public void testStationaryTrackIsImmotile() {
        TrackKinematics k = calculator.calculate(List.of(
                point(5, 5, 0.0),
                point(5, 5, 0.1),
                point(5, 5, 0.2)));

        assertEquals(0.0, k.getVcl(), EPS);
        assertEquals(0.0, k.getLin(), 0.0);
        assertEquals(0.0, k.getStr(), 0.0);
        assertEquals(0.0, k.getWob(), 0.0);
        assertEquals(MotilityClass.IMMOTILE, k.getMotilityClass());
    }

    @Test
    public void testClassification() {
        assertEquals(MotilityClass.PROGRESSIVE, calculator.classify(30, 10));
        assertEquals(MotilityClass.PROGRESSIVE, calculator.classify(25, 5));
        assertEquals(MotilityClass.NON_PROGRESSIVE, calculator.classify(30, 3));
        assertEquals(MotilityClass.NON_PROGRESSIVE, calculator.classify(10, 1));
        assertEquals(MotilityClass.IMMOTILE, calculator.classify(5, 0));
        assertEquals(MotilityClass.IMMOTILE, calculator.classify(4, 4));
    }

    @Test
    public void testSmoothingKeepsEndpoints() {
        double[] xs = {0, 1, 5, 2, 8, 10};
        double[] ys = {0, 4, -2, 3, -1, 0};

        double[][] smoothed = TrackKinematicsCalculator.smoothPath(xs, ys, 3);

        assertEquals(0.0, smoothed[0][0], EPS);
        assertEquals(10.0, smoothed[0][5], EPS);
        assertEquals(0.0, smoothed[1][5], EPS);
        assertEquals((0 + 1 + 5) / 3.0, smoothed[0][1], EPS);
        assertEquals((4 - 2 + 3) / 3.0, smoothed[1][2], EPS);
    }

    private static void assertInPercentRange(String name, double value) {
        assertTrue(name + " 应在[0, 100]内: " + value, value >= 0 && value <= 100.0 + EPS);
    }
}
