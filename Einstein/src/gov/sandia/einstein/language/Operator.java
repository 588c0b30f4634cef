/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

import java.util.TreeMap;

import gov.sandia.einstein.language.function.Conservative;
import gov.sandia.einstein.language.function.Derivative;
import gov.sandia.einstein.language.function.KroneckerDelta;
import gov.sandia.einstein.language.function.LeviCivita;

/**
    Base class of the abstract syntax tree (AST) hierarchy for Einstein-notation expressions.
    Nodes compare by structure, so two separately parsed copies of the same sub-expression
    are interchangeable as keys in a map.
**/
public class Operator implements Cloneable
{
    public interface Factory
    {
        public String   name ();  ///< Unique string for searching in the table of registered functions. Used explicitly by parser.
        public Operator createInstance ();
    }

    public Operator deepCopy ()
    {
        try
        {
            return (Operator) this.clone ();
        }
        catch (CloneNotSupportedException e)
        {
            return null;
        }
    }

    /**
        Lower numbers bind tighter. Used by render() to decide where parentheses are needed.
    **/
    public int precedence ()
    {
        return 1;
    }

    public void visit (Visitor visitor)
    {
        visitor.visit (this);
    }

    public Operator transform (Transformer transformer)
    {
        Operator result = transformer.transform (this);
        if (result != null) return result;
        return this;
    }

    /**
        Remove operators that have no effect due to specific values of their operands (for example: x*1),
        and fold constant sub-expressions into a single Constant.
        Only the specific rules coded in each subclass are applied. This is not a general-purpose simplifier.
    **/
    public Operator simplify ()
    {
        return this;
    }

    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (toString ());
    }

    /**
        Utility for subclasses. Renders the given operand, wrapped in parentheses if requested.
    **/
    public static void render (Renderer renderer, Operator op, boolean needParens)
    {
        if (needParens) renderer.result.append ("(");
        op.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    /**
        Extracts the value of a numeric constant.
        If this is not a constant, then return 0.
    **/
    public double getDouble ()
    {
        if (! (this instanceof Constant)) return 0;
        return ((Constant) this).value;
    }

    /**
        Determines if this is a numeric constant.
    **/
    public boolean isScalar ()
    {
        return this instanceof Constant;
    }

    /**
        Utility function to determine whether this operator tree contains a node structurally equal to target.
    **/
    public boolean contains (Operator target)
    {
        class ContainsVisitor extends Visitor
        {
            public boolean found;
            public boolean visit (Operator op)
            {
                if (found) return false;
                if (op.equals (target))
                {
                    found = true;
                    return false;
                }
                return true;
            }
        }
        ContainsVisitor cv = new ContainsVisitor ();
        visit (cv);
        return cv.found;
    }

    public String toString ()
    {
        return "unknown";
    }

    public boolean equals (Object that)
    {
        return that != null  &&  that.getClass () == getClass ();
    }

    public int hashCode ()
    {
        return getClass ().hashCode ();
    }


    // Static interface ------------------------------------------------------

    public static TreeMap<String,Factory> operators = new TreeMap<String,Factory> ();

    public static void register (Factory f)
    {
        operators.put (f.name (), f);
    }

    static
    {
        register (Conservative  .factory ());
        register (Derivative    .factory ());
        register (KroneckerDelta.factory ());
        register (LeviCivita    .factory ());
    }

    public static Operator parse (String line, SymbolTable symbols) throws ParseException
    {
        return ExpressionParser.parseExpression (line, symbols);
    }
}
