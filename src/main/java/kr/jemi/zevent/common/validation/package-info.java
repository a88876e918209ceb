@NamedInterface("validation")
package kr.jemi.zevent.common.validation;

import org.springframework.modulith.NamedInterface;
