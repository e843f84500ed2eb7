package org.javai.partlinker.render;

import static org.javai.partlinker.render.SymbolSyntax.coord;
import static org.javai.partlinker.render.SymbolSyntax.quote;

import org.javai.partlinker.geometry.BoxGeometry;
import org.javai.partlinker.geometry.SchematicGrid;
import org.javai.partlinker.geometry.UnitElement;
import org.javai.partlinker.geometry.UnitLayout;

/**
 * Writes a generated unit as a nested {@code (symbol "NAME_n_1" ...)} block.
 */
class UnitWriter {

	private static final String BODY_STYLE = "(stroke (width 0.254) (type default)) (fill (type background))";
	private static final String OVERLAY_STYLE = "(stroke (width 0.2) (type default)) (fill (type none))";
	private static final String FONT = "(font (size 1.27 1.27))";

	void write(BlockWriter out, int depth, String symbolName, UnitLayout unit) {
		out.line(depth, "(symbol " + quote(symbolName + "_" + unit.unitNumber() + "_1"));

		BoxGeometry box = unit.box();
		out.line(depth + 1, "(rectangle (start " + coord(box.left()) + " " + coord(box.top()) + ")"
				+ " (end " + coord(box.right()) + " " + coord(box.bottom()) + ")");
		out.line(depth + 2, BODY_STYLE);
		out.line(depth + 1, ")");

		for (UnitElement element : unit.elements()) {
			if (element instanceof UnitElement.PlacedPin pin) {
				writePin(out, depth + 1, pin);
			} else if (element instanceof UnitElement.Polyline polyline) {
				out.line(depth + 1, "(polyline (pts"
						+ " (xy " + coord(polyline.startX()) + " " + coord(polyline.startY()) + ")"
						+ " (xy " + coord(polyline.endX()) + " " + coord(polyline.endY()) + ")) "
						+ OVERLAY_STYLE + ")");
			} else if (element instanceof UnitElement.Arc arc) {
				out.line(depth + 1, "(arc"
						+ " (start " + coord(arc.startX()) + " " + coord(arc.startY()) + ")"
						+ " (mid " + coord(arc.midX()) + " " + coord(arc.midY()) + ")"
						+ " (end " + coord(arc.endX()) + " " + coord(arc.endY()) + ") "
						+ OVERLAY_STYLE + ")");
			}
		}
		out.line(depth, ")");
	}

	private void writePin(BlockWriter out, int depth, UnitElement.PlacedPin placed) {
		out.line(depth, "(pin " + placed.pin().role().electricalType() + " line"
				+ " (at " + coord(placed.x()) + " " + coord(placed.y()) + " " + placed.orientation() + ")"
				+ " (length " + coord(SchematicGrid.PIN_LENGTH) + ")");
		String nameEffects = placed.nameHidden() ? "(effects " + FONT + " (hide yes))" : "(effects " + FONT + ")";
		out.line(depth + 1, "(name " + quote(placed.pin().name()) + " " + nameEffects + ")");
		out.line(depth + 1, "(number " + quote(placed.pin().number()) + " (effects " + FONT + "))");
		out.line(depth, ")");
	}
}
