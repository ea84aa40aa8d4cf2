package org.vcad.ir.compact;

import org.vcad.ir.CsgOp;
import org.vcad.ir.SketchSegment2D;
import org.vcad.ir.Vec3;

import java.util.HashMap;
import java.util.Map;

/**
 * Compact IR 节点操作码表。
 * <p>
 * 每个常量同时声明：记号、参数个数、对应的 {@link CsgOp} 类型、解析（参数 → 操作）与格式化（操作 → 行）。
 * 解码器与编码器都只经过这张表，新增操作码时两个方向不会不一致。
 * <p>
 * {@link CsgOp.Empty} 没有独立的记号，按 {@code C 0 0 0} 输出。
 * {@link CsgOp.Sweep}/{@link CsgOp.Loft}/{@link CsgOp.ImportedMesh} 没有 Compact IR 表示。
 */
public enum Opcode {

    CUBE("C", 3, CsgOp.Cube.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Cube(a.vec3(0));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            Vec3 size = op instanceof CsgOp.Cube cube ? cube.size() : Vec3.ZERO;
            w.line(token()).vec3(size);
        }
    },

    CYLINDER("Y", 2, CsgOp.Cylinder.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Cylinder(a.number(0), a.number(1), 0);
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Cylinder c = (CsgOp.Cylinder) op;
            w.line(token()).num(c.radius()).num(c.height());
        }
    },

    SPHERE("S", 1, CsgOp.Sphere.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Sphere(a.number(0), 0);
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            w.line(token()).num(((CsgOp.Sphere) op).radius());
        }
    },

    CONE("K", 3, CsgOp.Cone.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Cone(a.number(0), a.number(1), a.number(2), 0);
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Cone c = (CsgOp.Cone) op;
            w.line(token()).num(c.radiusBottom()).num(c.radiusTop()).num(c.height());
        }
    },

    UNION("U", 2, CsgOp.Union.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Union(a.nodeRef(0), a.nodeRef(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Union u = (CsgOp.Union) op;
            w.line(token()).ref(u.left()).ref(u.right());
        }
    },

    DIFFERENCE("D", 2, CsgOp.Difference.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Difference(a.nodeRef(0), a.nodeRef(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Difference d = (CsgOp.Difference) op;
            w.line(token()).ref(d.left()).ref(d.right());
        }
    },

    INTERSECTION("I", 2, CsgOp.Intersection.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Intersection(a.nodeRef(0), a.nodeRef(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Intersection i = (CsgOp.Intersection) op;
            w.line(token()).ref(i.left()).ref(i.right());
        }
    },

    TRANSLATE("T", 4, CsgOp.Translate.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Translate(a.nodeRef(0), a.vec3(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Translate t = (CsgOp.Translate) op;
            w.line(token()).ref(t.child()).vec3(t.offset());
        }
    },

    ROTATE("R", 4, CsgOp.Rotate.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Rotate(a.nodeRef(0), a.vec3(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Rotate r = (CsgOp.Rotate) op;
            w.line(token()).ref(r.child()).vec3(r.angles());
        }
    },

    SCALE("X", 4, CsgOp.Scale.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Scale(a.nodeRef(0), a.vec3(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Scale s = (CsgOp.Scale) op;
            w.line(token()).ref(s.child()).vec3(s.factor());
        }
    },

    LINEAR_PATTERN("LP", 6, CsgOp.LinearPattern.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.LinearPattern(a.nodeRef(0), a.vec3(1), a.count(4), a.number(5));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.LinearPattern p = (CsgOp.LinearPattern) op;
            w.line(token()).ref(p.child()).vec3(p.direction()).count(p.count()).num(p.spacing());
        }
    },

    CIRCULAR_PATTERN("CP", 9, CsgOp.CircularPattern.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.CircularPattern(a.nodeRef(0), a.vec3(1), a.vec3(4), a.count(7), a.number(8));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.CircularPattern p = (CsgOp.CircularPattern) op;
            w.line(token()).ref(p.child()).vec3(p.axisOrigin()).vec3(p.axisDir())
                    .count(p.count()).num(p.angleDeg());
        }
    },

    SHELL("SH", 2, CsgOp.Shell.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Shell(a.nodeRef(0), a.number(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Shell s = (CsgOp.Shell) op;
            w.line(token()).ref(s.child()).num(s.thickness());
        }
    },

    FILLET("FI", 2, CsgOp.Fillet.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Fillet(a.nodeRef(0), a.number(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Fillet f = (CsgOp.Fillet) op;
            w.line(token()).ref(f.child()).num(f.radius());
        }
    },

    CHAMFER("CH", 2, CsgOp.Chamfer.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Chamfer(a.nodeRef(0), a.number(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Chamfer c = (CsgOp.Chamfer) op;
            w.line(token()).ref(c.child()).num(c.distance());
        }
    },

    /**
     * 多行草图块：头部 9 个数（origin、x_dir、y_dir），随后是 L/A 段行，以 END 结束。
     */
    SKETCH("SK", 9, CsgOp.Sketch2D.class) {
        @Override
        boolean block() {
            return true;
        }

        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Sketch2D(a.vec3(0), a.vec3(3), a.vec3(6), a.block());
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Sketch2D s = (CsgOp.Sketch2D) op;
            w.line(token()).vec3(s.origin()).gap().vec3(s.xDir()).gap().vec3(s.yDir());
            for (SketchSegment2D segment : s.segments()) {
                SegmentOpcode.forSegment(segment).write(segment, w);
            }
            w.line(CompactSyntax.END);
        }
    },

    EXTRUDE("E", 4, CsgOp.Extrude.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Extrude(a.nodeRef(0), a.vec3(1));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Extrude e = (CsgOp.Extrude) op;
            w.line(token()).ref(e.sketch()).vec3(e.direction());
        }
    },

    REVOLVE("V", 8, CsgOp.Revolve.class) {
        @Override
        CsgOp build(CompactArgs a) {
            return new CsgOp.Revolve(a.nodeRef(0), a.vec3(1), a.vec3(4), a.number(7));
        }

        @Override
        void write(CsgOp op, CompactLineWriter w) {
            CsgOp.Revolve r = (CsgOp.Revolve) op;
            w.line(token()).ref(r.sketch()).vec3(r.axisOrigin()).vec3(r.axisDir()).num(r.angleDeg());
        }
    };

    private static final Map<String, Opcode> BY_TOKEN = new HashMap<>();
    private static final Map<Class<? extends CsgOp>, Opcode> BY_TYPE = new HashMap<>();

    static {
        for (Opcode opcode : values()) {
            BY_TOKEN.put(opcode.token, opcode);
            BY_TYPE.put(opcode.opType, opcode);
        }
        BY_TYPE.put(CsgOp.Empty.class, CUBE);
    }

    private final String token;
    private final int arity;
    private final Class<? extends CsgOp> opType;

    Opcode(String token, int arity, Class<? extends CsgOp> opType) {
        this.token = token;
        this.arity = arity;
        this.opType = opType;
    }

    public String token() {
        return token;
    }

    /**
     * 操作码后面的参数个数（草图块只计头部）。
     */
    public int arity() {
        return arity;
    }

    public Class<? extends CsgOp> opType() {
        return opType;
    }

    /**
     * 是否为多行块（后续行直到 END 都属于该节点）。
     */
    boolean block() {
        return false;
    }

    abstract CsgOp build(CompactArgs args);

    abstract void write(CsgOp op, CompactLineWriter writer);

    /**
     * 按记号查找；未知记号返回 null。
     */
    public static Opcode fromToken(String token) {
        return BY_TOKEN.get(token);
    }

    /**
     * 按操作类型查找；没有 Compact IR 表示的操作返回 null。
     */
    public static Opcode forOp(CsgOp op) {
        return BY_TYPE.get(op.getClass());
    }
}
