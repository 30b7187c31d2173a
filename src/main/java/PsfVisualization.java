/**
 **
 ** PsfVisualization.java - visualization sink for intermediate simulation planes
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PsfVisualization.java is free software: you can redistribute it and/or modify
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
 * Optional display of intermediate planes (pupil amplitude, slice images, WFE maps).
 */
public interface PsfVisualization {
	/**
	 * @param title plane label
	 * @param pixels square plane, row-major
	 * @param width plane width
	 * @param halfExtent half of the plane extent, in units
	 * @param units extent units ("arcsec", "mm")
	 */
	void addImagePlot(String title, double [] pixels, int width, double halfExtent, String units);
	/** show everything added so far */
	void draw();

	public static final PsfVisualization NONE = new PsfVisualization() {
		public void addImagePlot(String title, double [] pixels, int width, double halfExtent, String units) {}
		public void draw() {}
	};
}
