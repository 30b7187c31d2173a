/**
 **
 ** SliceDescriptor.java - geometry of one image slicer slice
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SliceDescriptor.java is free software: you can redistribute it and/or modify
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

/**
 * One slice of the field of view. Width and offset are in resolution elements
 * of the reference (resample-to) wavelength, offset measured from the optical axis.
 */
public class SliceDescriptor {
	private final int    sliceNumber; // 1-based, ascending with offset
	private final double width;
	private final double offset;

	public SliceDescriptor(int sliceNumber, double width, double offset){
		if (sliceNumber<1) throw new IllegalArgumentException("slice numbers start from 1, got "+sliceNumber);
		if (!(width>0)) throw new IllegalArgumentException("slice width should be positive, got "+width);
		this.sliceNumber=sliceNumber;
		this.width=width;
		this.offset=offset;
	}
	public int getSliceNumber() {
		return this.sliceNumber;
	}
	public double getWidth() {
		return this.width;
	}
	public double getOffset() {
		return this.offset;
	}
	/** low edge of the slice band, inclusive */
	public double getLowEdge() {
		return this.offset-0.5*this.width;
	}
	/** high edge of the slice band, exclusive */
	public double getHighEdge() {
		return this.offset+0.5*this.width;
	}

	@Override
	public boolean equals(Object o) {
		if (this==o) return true;
		if (!(o instanceof SliceDescriptor)) return false;
		SliceDescriptor other=(SliceDescriptor) o;
		return (this.sliceNumber==other.sliceNumber) &&
				(Double.compare(this.width,other.width)==0) &&
				(Double.compare(this.offset,other.offset)==0);
	}
	@Override
	public int hashCode() {
		long bits=Double.doubleToLongBits(this.width)*31+Double.doubleToLongBits(this.offset);
		return this.sliceNumber*17+(int) (bits ^ (bits>>>32));
	}
	@Override
	public String toString() {
		return "slice "+this.sliceNumber+" (width="+this.width+", offset="+this.offset+")";
	}
}
