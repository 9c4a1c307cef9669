package io.jplist.mapper;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a field or record component to a dictionary key that differs from its Java name.
 *
 * <p>Without this annotation the Java name is used as the key.
 */
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface PlistKey {
  /**
   * Dictionary key used in the property list.
   *
   * @return the key
   */
  String value();
}
