/**
 **
 ** CompositeImage.java - coherent sum of the slice images for one wavelength
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CompositeImage.java is free software: you can redistribute it and/or modify
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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates slice images of one wavelength by complex (coherent) addition over the
 * full array. Finalized after the expected number of slices was added; a finalized
 * composite does not accept more slices.
 */
public class CompositeImage {
	private final int        size;
	private final BigDecimal wavelength;
	private final int        expectedSlices;
	private final double [][] reIm;
	private final List<Integer> sliceNumbers=new ArrayList<Integer>();
	private double pscale=Double.NaN;
	private boolean sealed=false; // handed to the cube

	public CompositeImage(int size, BigDecimal wavelength, int expectedSlices){
		if (size<1) throw new IllegalArgumentException("Composite image size should be positive, got "+size);
		if (expectedSlices<1) throw new IllegalArgumentException("Expected number of slices should be positive, got "+expectedSlices);
		this.size=size;
		this.wavelength=wavelength;
		this.expectedSlices=expectedSlices;
		this.reIm=new double [2][size*size];
	}

	/**
	 * Adds the slice field to the accumulator
	 * @param image slice image of the same size and wavelength
	 */
	public void addSlice(Image image){
		if (isFinalized()) {
			throw new IllegalStateException("Composite image for "+this.wavelength+" m already has all "+this.expectedSlices+" slices");
		}
		if (image.getSize()!=this.size) {
			throw new IllegalArgumentException("Slice image is "+image.getSize()+"x"+image.getSize()+", composite is "+this.size+"x"+this.size);
		}
		if (image.getWavelength().compareTo(this.wavelength)!=0) {
			throw new IllegalArgumentException("Slice wavelength "+image.getWavelength()+" m does not match composite wavelength "+this.wavelength+" m");
		}
		double [][] field=image.getReIm();
		for (int i=0;i<field[0].length;i++){
			this.reIm[0][i]+=field[0][i];
			this.reIm[1][i]+=field[1][i];
		}
		this.pscale=image.getPlateScale();
		this.sliceNumbers.add(image.getSliceNumber());
	}

	/** all expected slices were added */
	public boolean isFinalized(){
		return this.sealed || (this.sliceNumbers.size()>=this.expectedSlices);
	}

	/** called by the cube when it takes the image, no more changes after that */
	void seal(){
		this.sealed=true;
	}

	public boolean isSealed(){
		return this.sealed;
	}

	public int getNumberOfSlices(){
		return this.sliceNumbers.size();
	}

	/** slice numbers in the order they were added */
	public List<Integer> getSliceNumbers(){
		return Collections.unmodifiableList(this.sliceNumbers);
	}

	public int getExpectedSlices(){
		return this.expectedSlices;
	}

	public int getSize(){
		return this.size;
	}

	public BigDecimal getWavelength(){
		return this.wavelength;
	}

	/** plate scale of the added slices, NaN before the first one */
	public double getPlateScale(){
		return this.pscale;
	}

	public double [][] getReIm(){
		return new double [][] {this.reIm[0].clone(),this.reIm[1].clone()};
	}

	/** |E|^2 of the accumulated field */
	public double [] getIntensity(){
		double [] intensity=new double[this.reIm[0].length];
		for (int i=0;i<intensity.length;i++) intensity[i]=this.reIm[0][i]*this.reIm[0][i]+this.reIm[1][i]*this.reIm[1][i];
		return intensity;
	}
}
