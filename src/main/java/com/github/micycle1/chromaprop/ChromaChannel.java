package com.github.micycle1.chromaprop;

import com.github.micycle1.chromaprop.seed.SeedSet;

/** The two chrominance channels solved by propagation. */
public enum ChromaChannel {

	U {
		@Override
		public double seedValue(SeedSet seeds, int k) {
			return seeds.u(k);
		}
	},

	V {
		@Override
		public double seedValue(SeedSet seeds, int k) {
			return seeds.v(k);
		}
	};

	/** Target value of seed {@code k} for this channel. */
	public abstract double seedValue(SeedSet seeds, int k);
}
