package util.reflection;

import java.lang.reflect.Member;
import java.lang.reflect.Modifier;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.Sets;


/**
 * Visibility filter for member lookups, an immutable set of {@link BindingFlag}s.
 * <p>
 * Renders as <code>[Public|Instance]</code>, which is how it shows up in lookup error messages.
 */
public final class Binding {

   public static final Binding PUBLIC_INSTANCE = of(BindingFlag.PUBLIC, BindingFlag.INSTANCE);
   public static final Binding PUBLIC_STATIC   = of(BindingFlag.PUBLIC, BindingFlag.STATIC);

   private static final Joiner FLAG_JOINER = Joiner.on('|');

   public static Binding of( BindingFlag flag, BindingFlag... moreFlags ) {
      return new Binding(Sets.immutableEnumSet(flag, moreFlags));
   }

   private final Set<BindingFlag> _flags;

   private Binding( Set<BindingFlag> flags ) {
      _flags = flags;
   }

   public boolean contains( BindingFlag flag ) {
      return _flags.contains(flag);
   }

   public Set<BindingFlag> getFlags() {
      return _flags;
   }

   public boolean matches( Member member ) {
      return matches(member.getModifiers());
   }

   public boolean matches( int modifiers ) {
      BindingFlag scope = Modifier.isStatic(modifiers) ? BindingFlag.STATIC : BindingFlag.INSTANCE;
      BindingFlag visibility = Modifier.isPublic(modifiers) ? BindingFlag.PUBLIC : BindingFlag.NON_PUBLIC;
      return _flags.contains(scope) && _flags.contains(visibility);
   }

   @Override
   public boolean equals( Object o ) {
      return o instanceof Binding other && _flags.equals(other._flags);
   }

   @Override
   public int hashCode() {
      return _flags.hashCode();
   }

   @Override
   public String toString() {
      return "[" + FLAG_JOINER.join(_flags.stream().map(BindingFlag::getDisplayName).iterator()) + "]";
   }
}
