/**
 **
 ** Slicer.java - image slicer geometry
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Slicer.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partitions the field of view into an odd number of contiguous slices along x, centered on
 * the optical axis. Width and offsets are in resolution elements of the reference wavelength,
 * which span samplesPerElement samples on the common (resampled) grid.
 * <p>
 * Slice k covers x in [(offset-width/2)*samplesPerElement, (offset+width/2)*samplesPerElement)
 * samples from the center, so neighbouring slices neither overlap nor leave gaps.
 */
public class Slicer {
	private final int    nSlices;
	private final double sliceWidth;
	private final double samplesPerElement;
	private final List<SliceDescriptor> slices;

	/**
	 * @param nSlices number of slices, odd
	 * @param sliceWidth slice width, resolution elements
	 * @param samplesPerElement samples per resolution element on the common grid (pupil gamma of the reference)
	 */
	public Slicer(int nSlices, double sliceWidth, double samplesPerElement){
		if ((nSlices<1) || ((nSlices % 2)==0)) {
			throw new IllegalArgumentException("Number of slices should be odd, got "+nSlices);
		}
		if (!(sliceWidth>0)) throw new IllegalArgumentException("Slice width should be positive, got "+sliceWidth);
		if (!(samplesPerElement>0)) throw new IllegalArgumentException("Samples per resolution element should be positive, got "+samplesPerElement);
		this.nSlices=nSlices;
		this.sliceWidth=sliceWidth;
		this.samplesPerElement=samplesPerElement;
		List<SliceDescriptor> list=new ArrayList<SliceDescriptor>(nSlices);
		for (int s=0;s<nSlices;s++){
			double offset=(s-(nSlices-1)/2)*sliceWidth;
			list.add(new SliceDescriptor(s+1, sliceWidth, offset));
		}
		this.slices=Collections.unmodifiableList(list);
	}

	/** slice descriptors in ascending slice number (and offset) */
	public List<SliceDescriptor> getSlices(){
		return this.slices;
	}

	public int getNumberOfSlices(){
		return this.nSlices;
	}

	public double getSliceWidth(){
		return this.sliceWidth;
	}

	/** the slice with zero offset */
	public SliceDescriptor getCentralSlice(){
		return this.slices.get((this.nSlices-1)/2);
	}

	/**
	 * Keeps the columns of the image inside the slice band and zeroes the rest.
	 * @return new image tagged with the slice
	 */
	public Image slice(Image image, SliceDescriptor slice){
		int size=image.getSize();
		int hsize=size/2;
		double low= slice.getLowEdge()*this.samplesPerElement;
		double high=slice.getHighEdge()*this.samplesPerElement;
		double [][] src=image.getReIm();
		double [][] field=new double [2][size*size];
		for (int j=0;j<size;j++){
			double x=j-hsize;
			if ((x<low) || (x>=high)) continue;
			for (int i=0;i<size;i++){
				int index=i*size+j;
				field[0][index]=src[0][index];
				field[1][index]=src[1][index];
			}
		}
		return image.withField(field, slice);
	}

	/** all slices of the image, in slice number order */
	public List<Image> sliceUp(Image image){
		List<Image> result=new ArrayList<Image>(this.nSlices);
		for (SliceDescriptor slice:this.slices) result.add(slice(image, slice));
		return result;
	}

	/** number of image columns that fall into the slice */
	public int getSliceColumns(SliceDescriptor slice, int size){
		int hsize=size/2;
		double low= slice.getLowEdge()*this.samplesPerElement;
		double high=slice.getHighEdge()*this.samplesPerElement;
		int n=0;
		for (int j=0;j<size;j++){
			double x=j-hsize;
			if ((x>=low) && (x<high)) n++;
		}
		return n;
	}
}
