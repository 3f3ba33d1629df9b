package com.fnlower.desugar;

import com.fnlower.ast.*;
import com.fnlower.ir.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lowers the surface AST into the core IR.
 *
 * <p>The transformation is structural. Apart from drawing names from its {@link FreshVarGen}
 * it has no side effects, and it never mutates its input. Output invariants:
 * <ul>
 *   <li>every lambda takes exactly one parameter</li>
 *   <li>match cases carry no or-patterns</li>
 *   <li>lists, list patterns and {@code ::} are {@code Cons}/{@code Nil} variants</li>
 *   <li>external blocks are flattened into one declaration per item</li>
 * </ul>
 *
 * <p>One instance should be used for one run so that generated names stay distinct.
 * Instances are not thread-safe.
 */
public final class Desugarer {

    private static final Logger LOG = Logger.getLogger(Desugarer.class.getName());

    private final FreshVarGen gen;
    private final DesugarOptions options;

    public Desugarer() {
        this(new FreshVarGen(), DesugarOptions.defaults());
    }

    public Desugarer(FreshVarGen gen) {
        this(gen, DesugarOptions.defaults());
    }

    public Desugarer(FreshVarGen gen, DesugarOptions options) {
        this.gen = Objects.requireNonNull(gen, "gen");
        this.options = Objects.requireNonNull(options, "options");
    }

    public FreshVarGen gen() {
        return gen;
    }

    public DesugarOptions options() {
        return options;
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    /**
     * Desugars one surface expression.
     *
     * @throws DesugarException if the tree is structurally invalid
     */
    public CoreExpr desugar(Expr expr) {
        Objects.requireNonNull(expr, "expr");
        Location loc = expr.loc();

        if (expr instanceof IntLit lit) {
            return new CoreIntLit(lit.value(), loc);
        } else if (expr instanceof FloatLit lit) {
            return new CoreFloatLit(lit.value(), loc);
        } else if (expr instanceof StringLit lit) {
            return new CoreStringLit(lit.value(), loc);
        } else if (expr instanceof BoolLit lit) {
            return new CoreBoolLit(lit.value(), loc);
        } else if (expr instanceof UnitLit) {
            return new CoreUnitLit(loc);
        } else if (expr instanceof Var v) {
            return new CoreVar(v.name(), loc);
        } else if (expr instanceof Let let) {
            return new CoreLet(
                desugarPattern(let.pattern()),
                desugar(let.value()),
                desugar(let.body()),
                let.mutable(),
                let.recursive(),
                loc);
        } else if (expr instanceof LetRecExpr letRec) {
            return new CoreLetRecExpr(desugarBindings(letRec.bindings()), desugar(letRec.body()), loc);
        } else if (expr instanceof Lambda lambda) {
            return Lambdas.curry(this, lambda.params(), lambda.body(), loc);
        } else if (expr instanceof App app) {
            return new CoreApp(desugar(app.func()), desugarAll(app.args(), "Application", loc), loc);
        } else if (expr instanceof If ifExpr) {
            return desugarIf(ifExpr);
        } else if (expr instanceof Match match) {
            return new CoreMatch(desugar(match.expr()), OrPatterns.expandCases(this, match.cases()), loc);
        } else if (expr instanceof RecordLit record) {
            return new CoreRecord(desugarRecordFields(record.fields()), loc);
        } else if (expr instanceof RecordAccess access) {
            return new CoreRecordAccess(desugar(access.record()), access.field(), loc);
        } else if (expr instanceof RecordUpdate update) {
            return new CoreRecordUpdate(desugar(update.record()), desugarRecordFields(update.updates()), loc);
        } else if (expr instanceof ListLit list) {
            return Lists.desugarList(this, list.elements(), loc);
        } else if (expr instanceof ListCons cons) {
            return Lists.cons(desugar(cons.head()), desugar(cons.tail()), loc);
        } else if (expr instanceof BinOp binOp) {
            return Operators.desugarBinOp(this, binOp);
        } else if (expr instanceof UnaryOp unary) {
            return new CoreUnaryOp(Operators.toCore(unary.op()), desugar(unary.expr()), loc);
        } else if (expr instanceof Pipe pipe) {
            return Operators.desugarPipe(this, pipe);
        } else if (expr instanceof Block block) {
            return Blocks.desugarBlock(this, block.exprs(), loc);
        } else if (expr instanceof TypeAnnotation annotation) {
            return new CoreTypeAnnotation(
                desugar(annotation.expr()),
                TypeDesugarer.desugarTypeExpr(annotation.typeExpr()),
                loc);
        } else if (expr instanceof Unsafe unsafe) {
            return new CoreUnsafe(desugar(unsafe.expr()), loc);
        } else if (expr instanceof Tuple tuple) {
            return new CoreTuple(desugarAll(tuple.elements(), "Tuple", loc), loc);
        } else if (expr instanceof While loop) {
            return Loops.desugarWhile(this, loop);
        }
        throw new DesugarInternalError("Unknown expression kind: " + expr.kind(), loc);
    }

    /**
     * Desugars each element in order. {@code owner} names the enclosing construct in the
     * error raised for a missing element.
     */
    List<CoreExpr> desugarAll(List<Expr> exprs, String owner, Location loc) {
        List<CoreExpr> result = new ArrayList<>(exprs.size());
        for (int i = 0; i < exprs.size(); i++) {
            Expr e = exprs.get(i);
            if (e == null) {
                throw new DesugarException(owner + " has undefined element at index " + i, loc);
            }
            result.add(desugar(e));
        }
        return result;
    }

    // if c then a else b  =>  match c { true => a | false => b }
    private CoreExpr desugarIf(If ifExpr) {
        Location loc = ifExpr.loc();
        CoreExpr condition = desugar(ifExpr.condition());
        CoreExpr thenBranch = desugar(ifExpr.thenBranch());
        CoreExpr elseBranch = desugar(ifExpr.elseBranch());
        return new CoreMatch(condition, List.of(
            new CoreMatchCase(new CoreLiteralPattern(Boolean.TRUE, loc), null, thenBranch, loc),
            new CoreMatchCase(new CoreLiteralPattern(Boolean.FALSE, loc), null, elseBranch, loc)
        ), loc);
    }

    private List<CoreRecordField> desugarRecordFields(List<RecordField> fields) {
        List<CoreRecordField> result = new ArrayList<>(fields.size());
        for (RecordField field : fields) {
            if (field instanceof RecordField.Field f) {
                result.add(new CoreRecordField.Field(f.name(), desugar(f.value()), f.loc()));
            } else if (field instanceof RecordField.Spread s) {
                result.add(new CoreRecordField.Spread(desugar(s.expr()), s.loc()));
            }
        }
        return result;
    }

    private List<CoreRecBinding> desugarBindings(List<LetRecBinding> bindings) {
        List<CoreRecBinding> result = new ArrayList<>(bindings.size());
        for (LetRecBinding binding : bindings) {
            result.add(new CoreRecBinding(
                desugarPattern(binding.pattern()),
                desugar(binding.value()),
                binding.mutable(),
                binding.loc()));
        }
        return result;
    }

    // ========================================================================
    // Patterns
    // ========================================================================

    /**
     * Desugars a pattern that contains no or-patterns. Match cases go through
     * or-pattern expansion first; everywhere else an or-pattern is a bug upstream.
     */
    public CorePattern desugarPattern(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        Location loc = pattern.loc();

        if (pattern instanceof VarPattern v) {
            return new CoreVarPattern(v.name(), loc);
        } else if (pattern instanceof WildcardPattern) {
            return new CoreWildcardPattern(loc);
        } else if (pattern instanceof LiteralPattern lit) {
            return new CoreLiteralPattern(lit.literal(), loc);
        } else if (pattern instanceof ConstructorPattern ctor) {
            return new CoreVariantPattern(ctor.constructor(), desugarPatterns(ctor.args(), "Constructor pattern", loc), loc);
        } else if (pattern instanceof RecordPattern record) {
            List<CoreRecordPatternField> fields = new ArrayList<>(record.fields().size());
            for (RecordPattern.Field field : record.fields()) {
                fields.add(new CoreRecordPatternField(field.name(), desugarPattern(field.pattern()), field.loc()));
            }
            return new CoreRecordPattern(fields, loc);
        } else if (pattern instanceof ListPattern list) {
            return Lists.desugarListPattern(this, list);
        } else if (pattern instanceof TuplePattern tuple) {
            return new CoreTuplePattern(desugarPatterns(tuple.elements(), "Tuple pattern", loc), loc);
        } else if (pattern instanceof TypeAnnotatedPattern annotated) {
            // Annotations are checked by the type checker; nested ones all strip away here.
            return desugarPattern(annotated.pattern());
        } else if (pattern instanceof OrPattern) {
            throw new DesugarInternalError("Or-pattern should have been expanded before pattern desugaring", loc);
        }
        throw new DesugarInternalError("Unknown pattern kind: " + pattern.kind(), loc);
    }

    List<CorePattern> desugarPatterns(List<Pattern> patterns, String owner, Location loc) {
        List<CorePattern> result = new ArrayList<>(patterns.size());
        for (int i = 0; i < patterns.size(); i++) {
            Pattern p = patterns.get(i);
            if (p == null) {
                throw new DesugarException(owner + " has undefined element at index " + i, loc);
            }
            result.add(desugarPattern(p));
        }
        return result;
    }

    // ========================================================================
    // Types
    // ========================================================================

    public CoreTypeExpr desugarTypeExpr(TypeExpr typeExpr) {
        return TypeDesugarer.desugarTypeExpr(Objects.requireNonNull(typeExpr, "typeExpr"));
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    /**
     * Desugars one declaration. Every kind yields a single core declaration except an
     * external block, which yields one per item.
     */
    public List<CoreDeclaration> desugarDecl(Declaration decl) {
        Objects.requireNonNull(decl, "decl");
        Location loc = decl.loc();

        if (decl instanceof LetDecl let) {
            return List.of(new CoreLetDecl(
                desugarPattern(let.pattern()),
                desugar(let.value()),
                let.mutable(),
                let.recursive(),
                let.exported(),
                loc));
        } else if (decl instanceof LetRecGroup group) {
            return List.of(new CoreLetRecGroup(desugarBindings(group.bindings()), group.exported(), loc));
        } else if (decl instanceof TypeDecl type) {
            return List.of(new CoreTypeDecl(
                type.name(),
                type.params(),
                TypeDesugarer.desugarTypeDefinition(type.definition()),
                type.exported(),
                loc));
        } else if (decl instanceof ExternalDecl ext) {
            return List.of(new CoreExternalDecl(
                ext.name(),
                TypeDesugarer.desugarTypeExpr(ext.typeExpr()),
                ext.jsName(),
                ext.from(),
                ext.exported(),
                loc));
        } else if (decl instanceof ExternalTypeDecl ext) {
            return List.of(new CoreExternalTypeDecl(
                ext.name(),
                TypeDesugarer.desugarTypeExpr(ext.typeExpr()),
                ext.exported(),
                loc));
        } else if (decl instanceof ExternalBlock block) {
            return desugarExternalBlock(block);
        } else if (decl instanceof ImportDecl imp) {
            List<CoreImportItem> items = new ArrayList<>(imp.items().size());
            for (ImportItem item : imp.items()) {
                items.add(new CoreImportItem(item.name(), item.alias(), item.typeOnly()));
            }
            return List.of(new CoreImportDecl(items, imp.from(), loc));
        }
        throw new DesugarInternalError("Unknown declaration kind: " + decl.kind(), loc);
    }

    private List<CoreDeclaration> desugarExternalBlock(ExternalBlock block) {
        List<CoreDeclaration> result = new ArrayList<>(block.items().size());
        for (ExternalBlock.Item item : block.items()) {
            if (item instanceof ExternalBlock.ExternalValue value) {
                result.add(new CoreExternalDecl(
                    value.name(),
                    TypeDesugarer.desugarTypeExpr(value.typeExpr()),
                    value.jsName(),
                    block.from(),
                    block.exported(),
                    value.loc()));
            } else if (item instanceof ExternalBlock.ExternalType type) {
                result.add(new CoreExternalTypeDecl(
                    type.name(),
                    TypeDesugarer.desugarTypeExpr(type.typeExpr()),
                    block.exported(),
                    type.loc()));
            }
        }
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("Expanded external block at " + block.loc() + " into " + result.size() + " declarations");
        }
        return result;
    }

    // ========================================================================
    // Modules
    // ========================================================================

    /**
     * Desugars imports and declarations in source order. Import results are collected
     * into {@link CoreModule#imports()}, everything else into {@link CoreModule#declarations()}.
     */
    public CoreModule desugarModule(SourceModule module) {
        Objects.requireNonNull(module, "module");
        List<CoreImportDecl> imports = new ArrayList<>();
        List<CoreDeclaration> declarations = new ArrayList<>();

        List<Declaration> all = new ArrayList<>(module.imports());
        all.addAll(module.declarations());

        for (Declaration decl : all) {
            Desugarer desugarer = options.freshNamesPerDeclaration()
                ? new Desugarer(new FreshVarGen(), options)
                : this;
            for (CoreDeclaration core : desugarer.desugarDecl(decl)) {
                if (core instanceof CoreImportDecl imp) {
                    imports.add(imp);
                } else {
                    declarations.add(core);
                }
            }
        }

        LOG.fine(() -> "Desugared module " + (module.loc() != null ? module.loc().file() : "<unknown>")
            + ": " + imports.size() + " imports, " + declarations.size() + " declarations");
        return new CoreModule(imports, declarations, module.loc());
    }
}
