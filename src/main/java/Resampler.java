/**
 **
 ** Resampler.java - bicubic spline regridding of square planes
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Resampler.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Resamples square planes from one uniform symmetric grid to another with a separable
 * natural cubic spline (bicubic in 2-d): rows are interpolated first, then columns of the
 * intermediate result. The spline passes through the input samples, so resampling onto the
 * input grid returns the input. Output samples outside of the input grid are set to 0.
 * <p>
 * Grid coordinates: sample k is at start+k*step, the same for x (columns) and y (rows).
 */
public class Resampler {
	private static final double EDGE_TOLERANCE=1E-9; // in input steps

	private final SplineInterpolator interpolator=new SplineInterpolator();

	public static int getOutputSize(double pscale, double hfov){
		if (!(pscale>0) || !(hfov>0)) {
			throw new IllegalArgumentException("Plate scale and half field of view should be positive (pscale="+pscale+", hfov="+hfov+")");
		}
		return (int) Math.round(2*hfov/pscale);
	}

	/** resample {re,im} planes independently */
	public double [][] resample2d(
			double [][] reIm,
			double inStart,
			double inStep,
			double outStart,
			double outStep,
			int outSize){
		int inSize=(int) Math.round(Math.sqrt(reIm[0].length));
		return new double [][] {
				resample2d(reIm[0], inSize, inStart, inStep, outStart, outStep, outSize),
				resample2d(reIm[1], inSize, inStart, inStep, outStart, outStep, outSize)};
	}

	/**
	 * @param data input plane, inSize*inSize, row-major
	 * @param inSize input width
	 * @param inStart coordinate of the first input sample
	 * @param inStep input sample spacing
	 * @param outStart coordinate of the first output sample
	 * @param outStep output sample spacing
	 * @param outSize output width
	 * @return outSize*outSize plane
	 */
	public double [] resample2d(
			double [] data,
			int inSize,
			double inStart,
			double inStep,
			double outStart,
			double outStep,
			int outSize){
		if (inSize*inSize!=data.length) {
			throw new IllegalArgumentException("Input plane should be "+inSize+"x"+inSize+", got "+data.length+" samples");
		}
		if (inSize<3) throw new IllegalArgumentException("Need at least 3x3 samples to interpolate");
		if (!(inStep>0)) throw new IllegalArgumentException("Input step should be positive, got "+inStep);
		if (outSize<1) throw new IllegalArgumentException("Output size should be positive, got "+outSize);
		double [] knots=new double [inSize];
		for (int k=0;k<inSize;k++) knots[k]=inStart+k*inStep;
		double [] positions=new double [outSize];
		boolean [] inside=new boolean [outSize];
		for (int i=0;i<outSize;i++){
			double x=outStart+i*outStep;
			double u=(x-inStart)/inStep;
			inside[i]=(u>=-EDGE_TOLERANCE) && (u<=(inSize-1)+EDGE_TOLERANCE);
			positions[i]=Math.min(Math.max(x, knots[0]), knots[inSize-1]);
		}
		double [] line=     new double [inSize];
		double [] lineOut=  new double [outSize];
		double [] rowsDone= new double [inSize*outSize];
		for (int row=0;row<inSize;row++){
			System.arraycopy(data, row*inSize, line, 0, inSize);
			interpolate(knots, line, positions, inside, lineOut);
			System.arraycopy(lineOut, 0, rowsDone, row*outSize, outSize);
		}
		double [] result=new double [outSize*outSize];
		for (int col=0;col<outSize;col++){
			for (int row=0;row<inSize;row++) line[row]=rowsDone[row*outSize+col];
			interpolate(knots, line, positions, inside, lineOut);
			for (int row=0;row<outSize;row++) result[row*outSize+col]=lineOut[row];
		}
		return result;
	}

	private void interpolate(double [] knots, double [] y, double [] positions, boolean [] inside, double [] out){
		PolynomialSplineFunction spline=this.interpolator.interpolate(knots, y);
		for (int i=0;i<out.length;i++){
			out[i]=inside[i]?spline.value(positions[i]):0.0;
		}
	}
}
