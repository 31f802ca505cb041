package com.github.micycle1.chromaprop.graph;

/**
 * Weighted 4-neighbour adjacency over an H x W pixel grid.
 * <p>
 * Only the edges are stored: one weight per horizontal edge
 * {@code (r,c)-(r,c+1)} and one per vertical edge {@code (r,c)-(r+1,c)}, so
 * memory is proportional to the {@code 2HW - H - W} edges. There is no
 * wraparound at the borders. Weights are symmetric and lie in [0, 1]; a weight
 * of exactly 0 only arises when the Gaussian underflows across a very large
 * luminance step and means the two pixels are not coupled.
 */
public final class SimilarityGraph {

	private final int height;
	private final int width;
	private final double sigma;
	private final double[] horizontal; // height x (width-1)
	private final double[] vertical; // (height-1) x width

	SimilarityGraph(int height, int width, double sigma, double[] horizontal, double[] vertical) {
		this.height = height;
		this.width = width;
		this.sigma = sigma;
		this.horizontal = horizontal;
		this.vertical = vertical;
	}

	public int getHeight() {
		return height;
	}

	public int getWidth() {
		return width;
	}

	/** Number of pixels (graph nodes). */
	public int getNodeCount() {
		return height * width;
	}

	/** Number of undirected edges, {@code 2HW - H - W}. */
	public int getEdgeCount() {
		return horizontal.length + vertical.length;
	}

	public double getSigma() {
		return sigma;
	}

	/** Weight of the edge between {@code (row, col)} and {@code (row, col + 1)}. */
	public double weightRight(int row, int col) {
		return horizontal[row * (width - 1) + col];
	}

	/** Weight of the edge between {@code (row, col)} and {@code (row + 1, col)}. */
	public double weightDown(int row, int col) {
		return vertical[row * width + col];
	}

	/**
	 * Writes the neighbours of pixel {@code index} and the corresponding edge
	 * weights, in the order left, right, up, down (absent neighbours skipped).
	 *
	 * @param nbrs    receives neighbour indices, length >= 4
	 * @param weights receives edge weights, length >= 4
	 * @return number of neighbours written (2, 3 or 4 on grids larger than 1x1)
	 */
	public int neighbors(int index, int[] nbrs, double[] weights) {
		int r = index / width;
		int c = index % width;
		int n = 0;
		if (c > 0) {
			nbrs[n] = index - 1;
			weights[n++] = weightRight(r, c - 1);
		}
		if (c < width - 1) {
			nbrs[n] = index + 1;
			weights[n++] = weightRight(r, c);
		}
		if (r > 0) {
			nbrs[n] = index - width;
			weights[n++] = weightDown(r - 1, c);
		}
		if (r < height - 1) {
			nbrs[n] = index + width;
			weights[n++] = weightDown(r, c);
		}
		return n;
	}

	/** Weighted degree: the sum of the weights of the edges incident to {@code index}. */
	public double degree(int index) {
		int r = index / width;
		int c = index % width;
		double d = 0.0;
		if (c > 0) {
			d += weightRight(r, c - 1);
		}
		if (c < width - 1) {
			d += weightRight(r, c);
		}
		if (r > 0) {
			d += weightDown(r - 1, c);
		}
		if (r < height - 1) {
			d += weightDown(r, c);
		}
		return d;
	}

	@Override
	public String toString() {
		return "SimilarityGraph{" + height + "x" + width + ", edges=" + getEdgeCount() + ", sigma=" + sigma + "}";
	}
}
