/**
 **
 ** ImageJVisualization.java - shows intermediate simulation planes as ImageJ stacks
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ImageJVisualization.java is free software: you can redistribute it and/or modify
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;

/**
 * Collects plotted planes and shows them as ImageJ stacks, one stack per plane size.
 * Slice labels carry the plot title and the plane extent.
 */
public class ImageJVisualization implements PsfVisualization {
	private final String title;
	private final List<String> labels=new ArrayList<String>();
	private final List<double []> planes=new ArrayList<double []>();
	private final List<Integer> widths=new ArrayList<Integer>();

	public ImageJVisualization(String title){
		this.title=title;
	}

	public synchronized void addImagePlot(String title, double [] pixels, int width, double halfExtent, String units) {
		if (pixels==null) return;
		if (pixels.length!=(width*width)){
			System.out.println("addImagePlot(): pixels.length="+pixels.length+" != width*width ("+width+"*"+width+")");
			return;
		}
		this.labels.add(title+" [±"+IJ.d2s(halfExtent,4)+" "+units+"]");
		this.planes.add(pixels.clone());
		this.widths.add(width);
	}

	public synchronized int getNumberOfPlots(){
		return this.planes.size();
	}

	/** Builds one stack per distinct plane width, in the order the widths first appeared */
	public synchronized List<ImagePlus> getStacks() {
		Map<Integer,ImageStack> stacks=new LinkedHashMap<Integer,ImageStack>();
		for (int n=0;n<this.planes.size();n++){
			int width=this.widths.get(n);
			ImageStack stack=stacks.get(width);
			if (stack==null){
				stack=new ImageStack(width,width);
				stacks.put(width, stack);
			}
			double [] pixels=this.planes.get(n);
			float [] fpixels=new float[pixels.length];
			for (int j=0;j<fpixels.length;j++) fpixels[j]=(float)pixels[j];
			stack.addSlice(this.labels.get(n), fpixels);
		}
		List<ImagePlus> result=new ArrayList<ImagePlus>();
		for (Map.Entry<Integer,ImageStack> entry:stacks.entrySet()){
			ImagePlus imp_stack = new ImagePlus(this.title+"-"+entry.getKey(), entry.getValue());
			imp_stack.getProcessor().resetMinAndMax();
			result.add(imp_stack);
		}
		return result;
	}

	public void draw() {
		for (ImagePlus imp:getStacks()) imp.show();
	}
}
