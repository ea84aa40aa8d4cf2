package org.vcad.ir.compact;

import org.vcad.ir.SketchSegment2D;

/**
 * 草图块内的段操作码：{@code L x1 y1 x2 y2}、{@code A x1 y1 x2 y2 cx cy ccw}。
 */
public enum SegmentOpcode {

    LINE("L", 4) {
        @Override
        SketchSegment2D build(CompactArgs a) {
            return new SketchSegment2D.Line(a.vec2(0), a.vec2(2));
        }

        @Override
        void write(SketchSegment2D segment, CompactLineWriter w) {
            w.line(token()).vec2(segment.start()).vec2(segment.end());
        }
    },

    ARC("A", 7) {
        @Override
        SketchSegment2D build(CompactArgs a) {
            return new SketchSegment2D.Arc(a.vec2(0), a.vec2(2), a.vec2(4), a.flag(6));
        }

        @Override
        void write(SketchSegment2D segment, CompactLineWriter w) {
            SketchSegment2D.Arc arc = (SketchSegment2D.Arc) segment;
            w.line(token()).vec2(arc.start()).vec2(arc.end()).vec2(arc.center()).flag(arc.ccw());
        }
    };

    private final String token;
    private final int arity;

    SegmentOpcode(String token, int arity) {
        this.token = token;
        this.arity = arity;
    }

    public String token() {
        return token;
    }

    public int arity() {
        return arity;
    }

    abstract SketchSegment2D build(CompactArgs args);

    abstract void write(SketchSegment2D segment, CompactLineWriter writer);

    public static SegmentOpcode fromToken(String token) {
        for (SegmentOpcode opcode : values()) {
            if (opcode.token.equals(token)) {
                return opcode;
            }
        }
        return null;
    }

    static SegmentOpcode forSegment(SketchSegment2D segment) {
        return segment instanceof SketchSegment2D.Arc ? ARC : LINE;
    }
}
