package com.github.micycle1.chromaprop;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.github.micycle1.chromaprop.image.ImageData;
import com.github.micycle1.chromaprop.image.Plane;
import com.github.micycle1.chromaprop.image.RgbImage;
import com.github.micycle1.chromaprop.image.YuvConversion;

public class ReconstructorTest {

	@Test
	void zeroChromaGivesGray() {
		Plane y = Plane.of(1, 4, new double[] { 0, 10.4, 10.6, 255 });
		Plane zero = Plane.filled(1, 4, 0);
		RgbImage rgb = Reconstructor.reconstruct(y, zero, zero);
		int[] expected = { 0, 10, 11, 255 };
		for (int c = 0; c < 4; c++) {
			for (int ch = 0; ch < 3; ch++) {
				assertEquals(expected[c], rgb.get(0, c, ch));
			}
		}
	}

	@Test
	void invertsTheForwardTransform() {
		int[][][] px = { { { 255, 0, 0 }, { 0, 255, 0 }, { 0, 0, 255 } }, { { 12, 200, 97 }, { 250, 250, 5 }, { 128, 64, 32 } } };
		ImageData img = ImageData.ofPixels(px);
		Plane[] yuv = YuvConversion.toYuv(img);
		RgbImage rgb = Reconstructor.reconstruct(yuv[0], yuv[1], yuv[2]);
		for (int r = 0; r < 2; r++) {
			for (int c = 0; c < 3; c++) {
				for (int ch = 0; ch < 3; ch++) {
					assertEquals(px[r][c][ch], rgb.get(r, c, ch), 1, "pixel " + r + "," + c + " channel " + ch);
				}
			}
		}
	}

	@Test
	void clampsOutOfGamutValues() {
		Plane y = Plane.of(1, 2, new double[] { 250, 5 });
		Plane u = Plane.of(1, 2, new double[] { 100, -100 });
		Plane v = Plane.of(1, 2, new double[] { 100, -100 });
		RgbImage rgb = Reconstructor.reconstruct(y, u, v);
		assertEquals(255, rgb.get(0, 0, 0));
		assertEquals(255, rgb.get(0, 0, 2));
		assertEquals(0, rgb.get(0, 1, 0));
		assertEquals(0, rgb.get(0, 1, 2));
		assertEquals(0, Reconstructor.toSample(Double.NaN));
		assertEquals(255, Reconstructor.toSample(Double.POSITIVE_INFINITY));
	}

	@Test
	void rejectsShapeMismatch() {
		Plane y = Plane.filled(2, 2, 1);
		InvalidInputException ex = assertThrows(InvalidInputException.class,
				() -> Reconstructor.reconstruct(y, Plane.filled(2, 2, 0), Plane.filled(2, 3, 0)));
		assertEquals(PipelineStage.RECONSTRUCTION, ex.getStage());
	}

	@Test
	void psnrOfIdenticalAndPerturbedImages() {
		ImageData truth = ImageData.ofPixels(new int[][][] { { { 10, 20, 30 }, { 40, 50, 60 } } });
		RgbImage same = RgbImage.of(1, 2, new int[] { 10, 20, 30, 40, 50, 60 });
		assertEquals(Double.POSITIVE_INFINITY, QualityMetrics.psnr(truth, same));
		RgbImage off = RgbImage.of(1, 2, new int[] { 11, 21, 31, 41, 51, 61 });
		assertEquals(20 * Math.log10(255.0), QualityMetrics.psnr(truth, off), 1e-9);

		// a gray truth is compared on all three channels
		ImageData gray = ImageData.ofGray(new int[][] { { 100 } });
		assertEquals(Double.POSITIVE_INFINITY, QualityMetrics.psnr(gray, RgbImage.of(1, 1, new int[] { 100, 100, 100 })));
		assertThrows(InvalidInputException.class, () -> QualityMetrics.psnr(truth, RgbImage.of(2, 1, new int[6])));
		assertEquals(20 * Math.log10(255.0 / 2.0), QualityMetrics.psnr(Plane.filled(2, 2, 5), Plane.filled(2, 2, 7)), 1e-9);
	}
}
